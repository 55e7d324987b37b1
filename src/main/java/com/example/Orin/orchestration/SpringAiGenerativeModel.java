package com.example.Orin.orchestration;

import com.example.Orin.exception.ModelUnavailableException;
import com.example.Orin.tools.AgentTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link GenerativeModel} backed by Spring AI chat models.
 * <p>
 * Tools are announced to the model by definition only; internal tool execution is
 * switched off so every requested call comes back to the orchestrator.
 */
public class SpringAiGenerativeModel implements GenerativeModel {

    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerativeModel.class);

    private final Supplier<Map<String, ChatModel>> chatModels;
    private final String defaultModel;

    /**
     * @param chatModels   available chat models keyed by lower-case name, resolved on every call
     * @param defaultModel name used when a request gives no hint or an unknown one
     */
    public SpringAiGenerativeModel(Supplier<Map<String, ChatModel>> chatModels, String defaultModel) {
        this.chatModels = chatModels;
        this.defaultModel = defaultModel;
    }

    @Override
    public ModelReply think(ModelRequest request) {
        ChatModel chatModel = resolveModel(request.modelHint());

        ToolCallingChatOptions options = ToolCallingChatOptions.builder()
                .toolCallbacks(toCallbacks(request.tools()))
                .internalToolExecutionEnabled(false)
                .build();

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(toMessages(request), options));
        } catch (RuntimeException e) {
            throw new ModelUnavailableException("Chat model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ModelUnavailableException("Chat model returned an empty response");
        }
        AssistantMessage output = response.getResult().getOutput();

        List<ToolCallRequest> calls = new ArrayList<>();
        if (output.hasToolCalls()) {
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                calls.add(new ToolCallRequest(call.id(), call.name(), call.arguments()));
            }
        }
        return new ModelReply(output.getText(), calls);
    }

    /**
     * Resolve a chat model by hint.
     * Fallback:
     *  - configured default model
     *  - any available model if nothing matches
     */
    private ChatModel resolveModel(String hint) {
        Map<String, ChatModel> available = chatModels.get();
        if (available == null || available.isEmpty()) {
            throw new ModelUnavailableException("No chat model is configured");
        }
        String key = Optional.ofNullable(hint)
                .filter(h -> !h.isBlank())
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .orElse(defaultModel);
        ChatModel model = available.get(key);
        if (model == null) {
            model = available.get(defaultModel);
        }
        if (model == null) {
            model = available.values().iterator().next();
            log.debug("Model '{}' not available, falling back to {}", key, model.getClass().getSimpleName());
        }
        return model;
    }

    private List<Message> toMessages(ModelRequest request) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(request.systemPrompt()));
        for (ConversationMessage message : request.messages()) {
            switch (message.role()) {
                case USER -> messages.add(new UserMessage(message.content()));
                case ASSISTANT -> messages.add(new AssistantMessage(
                        message.content() == null ? "" : message.content(),
                        Map.of(),
                        message.toolCalls().stream()
                                .map(c -> new AssistantMessage.ToolCall(c.id(), "function", c.name(), c.arguments()))
                                .toList()));
                case TOOL -> messages.add(new ToolResponseMessage(List.of(
                        new ToolResponseMessage.ToolResponse(
                                message.toolCallId(), message.toolName(), message.content()))));
            }
        }
        return messages;
    }

    private static List<ToolCallback> toCallbacks(List<AgentTool> tools) {
        return tools.stream()
                .<ToolCallback>map(DeclaredTool::new)
                .toList();
    }

    /**
     * Announces a tool to the model. Never executed by Spring AI because internal
     * tool execution is disabled.
     */
    private static final class DeclaredTool implements ToolCallback {

        private final ToolDefinition definition;

        private DeclaredTool(AgentTool tool) {
            this.definition = ToolDefinition.builder()
                    .name(tool.name())
                    .description(tool.description())
                    .inputSchema(tool.inputSchema())
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException(
                    "Tool " + definition.name() + " is dispatched by the orchestrator");
        }
    }
}
