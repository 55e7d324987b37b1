package com.example.Orin.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Answer returned to the chat surface.
 *
 * @param response  cleaned answer text shown to the user
 * @param sources   deduplicated citations, in first-seen order
 * @param success   false when the request failed and {@code response} is an apology
 * @param toolsUsed tool names in invocation order
 * @param error     diagnostic cause of a failure, absent on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
        String response,
        List<SourceRecord> sources,
        boolean success,
        List<String> toolsUsed,
        String error
) {

    public static QueryResponse success(String response, List<SourceRecord> sources, List<String> toolsUsed) {
        return new QueryResponse(response, List.copyOf(sources), true, List.copyOf(toolsUsed), null);
    }

    public static QueryResponse failure(String response, List<String> toolsUsed, String error) {
        return new QueryResponse(response, List.of(), false, List.copyOf(toolsUsed), error);
    }
}
