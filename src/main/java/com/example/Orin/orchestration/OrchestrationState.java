package com.example.Orin.orchestration;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable bookkeeping of one orchestration run. Owned by a single request, never shared.
 */
final class OrchestrationState {

    enum Phase { THINKING, TOOL_DISPATCH, ANSWERING, DONE }

    private final List<ConversationMessage> conversation;
    private final List<String> toolsInvoked = new ArrayList<>();
    private Phase phase = Phase.THINKING;
    private int iterations;
    private boolean exhausted;
    private String lastModelText;
    private String lastToolResult;

    OrchestrationState(List<ConversationMessage> history, String userInput) {
        this.conversation = new ArrayList<>(history);
        this.conversation.add(ConversationMessage.user(userInput));
    }

    List<ConversationMessage> conversation() {
        return conversation;
    }

    void moveTo(Phase next) {
        phase = next;
    }

    Phase phase() {
        return phase;
    }

    void noteModelText(String text) {
        if (text != null && !text.isBlank()) {
            lastModelText = text;
        }
    }

    /** Starts a dispatch step for the given model turn. */
    void beginDispatch(ModelReply reply) {
        iterations++;
        phase = Phase.TOOL_DISPATCH;
        conversation.add(ConversationMessage.assistantToolCalls(reply.text(), reply.toolCalls()));
    }

    void addToolResult(ToolCallRequest call, String result) {
        toolsInvoked.add(call.name());
        lastToolResult = result;
        conversation.add(ConversationMessage.toolResult(call, result));
    }

    void markExhausted() {
        exhausted = true;
    }

    int iterations() {
        return iterations;
    }

    boolean exhausted() {
        return exhausted;
    }

    List<String> toolsInvoked() {
        return List.copyOf(toolsInvoked);
    }

    String lastModelText() {
        return lastModelText;
    }

    String lastToolResult() {
        return lastToolResult;
    }
}
