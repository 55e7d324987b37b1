package com.example.Orin.tools;

import com.example.Orin.model.UserContext;
import com.example.Orin.orchestration.QueryScope;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Everything a tool sees for one call: the parsed arguments, the provenance scope
 * of the current request, and the caller.
 */
public record ToolInvocation(JsonNode arguments, QueryScope scope, UserContext user) {

    public ToolInvocation {
        if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
            arguments = JsonNodeFactory.instance.objectNode();
        }
        if (user == null) {
            user = UserContext.anonymous();
        }
    }

    /**
     * Text value of a top-level argument, or {@code null} when absent or blank.
     */
    public String argument(String name) {
        JsonNode value = arguments.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        return text.isBlank() ? null : text.trim();
    }
}
