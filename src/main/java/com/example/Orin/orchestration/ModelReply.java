package com.example.Orin.orchestration;

import java.util.List;

/**
 * One model turn: either a final answer ({@code toolCalls} empty) or tool requests.
 */
public record ModelReply(String text, List<ToolCallRequest> toolCalls) {

    public ModelReply {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelReply answer(String text) {
        return new ModelReply(text, List.of());
    }

    public static ModelReply toolCall(String id, String name, String arguments) {
        return new ModelReply("", List.of(new ToolCallRequest(id, name, arguments)));
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
