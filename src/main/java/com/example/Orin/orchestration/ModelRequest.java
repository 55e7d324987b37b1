package com.example.Orin.orchestration;

import com.example.Orin.tools.AgentTool;

import java.util.List;

/**
 * Input for one model turn.
 *
 * @param systemPrompt instructions and user context
 * @param messages     memory window followed by the current exchange
 * @param tools        tool catalog the model may call
 * @param modelHint    optional model name (e.g. "deepseek", "openai")
 */
public record ModelRequest(
        String systemPrompt,
        List<ConversationMessage> messages,
        List<AgentTool> tools,
        String modelHint
) {
    public ModelRequest {
        messages = List.copyOf(messages);
        tools = List.copyOf(tools);
    }
}
