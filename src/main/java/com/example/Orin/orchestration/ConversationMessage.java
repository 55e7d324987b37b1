package com.example.Orin.orchestration;

import java.util.List;

/**
 * One entry of the running conversation sent to the model.
 */
public record ConversationMessage(
        Role role,
        String content,
        List<ToolCallRequest> toolCalls,
        String toolCallId,
        String toolName
) {

    public enum Role { USER, ASSISTANT, TOOL }

    public ConversationMessage {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content, List.of(), null, null);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Role.ASSISTANT, content, List.of(), null, null);
    }

    public static ConversationMessage assistantToolCalls(String content, List<ToolCallRequest> toolCalls) {
        return new ConversationMessage(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static ConversationMessage toolResult(ToolCallRequest call, String result) {
        return new ConversationMessage(Role.TOOL, result, List.of(), call.id(), call.name());
    }
}
