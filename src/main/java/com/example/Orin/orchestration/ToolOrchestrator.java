package com.example.Orin.orchestration;

import com.example.Orin.config.OrinProperties;
import com.example.Orin.exception.ModelUnavailableException;
import com.example.Orin.exception.RequestCancelledException;
import com.example.Orin.model.SourceRecord;
import com.example.Orin.model.UserContext;
import com.example.Orin.service.ChatMemoryStore;
import com.example.Orin.tools.AgentTool;
import com.example.Orin.tools.ToolInvocation;
import com.example.Orin.tools.ToolRegistry;
import com.example.Orin.tools.ToolResult;
import com.example.Orin.util.LegacyCitationParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Bounded think/act loop:
 * - Ask the model with the memory window, the conversation so far and the tool catalog
 * - Dispatch the tools it requests and feed the results back
 * - Stop on a final answer, or force a partial answer once the iteration cap is hit
 *
 * Tool failures never abort the run; they come back to the model as text.
 * A model failure or corrupted conversation memory does.
 */
@Service
public class ToolOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ToolOrchestrator.class);

    static final String EXHAUSTED_NOTICE =
            "I could not complete the research for your question within the allowed number of steps.";

    private final GenerativeModel model;
    private final ToolRegistry toolRegistry;
    private final ChatMemoryStore memoryStore;
    private final ObjectMapper objectMapper;
    private final OrinProperties.Orchestrator settings;

    public ToolOrchestrator(GenerativeModel model,
                            ToolRegistry toolRegistry,
                            ChatMemoryStore memoryStore,
                            ObjectMapper objectMapper,
                            OrinProperties properties) {
        this.model = model;
        this.toolRegistry = toolRegistry;
        this.memoryStore = memoryStore;
        this.objectMapper = objectMapper;
        this.settings = properties.getOrchestrator();
    }

    /**
     * Run one request with a fresh provenance scope.
     */
    public OrchestrationOutcome run(String userInput, UserContext user) {
        return run(userInput, user, new QueryScope());
    }

    /**
     * Run one request against the given scope. The scope is emptied before the run
     * starts and again when it ends, whatever the outcome.
     *
     * @throws ModelUnavailableException                              when the model fails or times out
     * @throws com.example.Orin.exception.ConversationMemoryException when stored memory is corrupted
     * @throws RequestCancelledException                              when the calling thread is interrupted
     */
    public OrchestrationOutcome run(String userInput, UserContext user, QueryScope scope) {
        UserContext caller = user == null ? UserContext.anonymous() : user;
        UserContext.ResolvedSession session = caller.resolveSession();
        scope.reset();
        try {
            OrchestrationState state = new OrchestrationState(loadWindow(session), userInput);
            String systemPrompt = buildSystemPrompt(caller);
            List<AgentTool> tools = toolRegistry.allTools();

            ModelReply reply = think(new ModelRequest(systemPrompt, state.conversation(), tools, caller.model()));
            while (reply.hasToolCalls()) {
                state.noteModelText(reply.text());
                if (state.iterations() >= settings.getMaxIterations()) {
                    state.markExhausted();
                    log.info("Iteration cap {} reached, answering with what is available", settings.getMaxIterations());
                    break;
                }
                state.beginDispatch(reply);
                for (ToolCallRequest call : reply.toolCalls()) {
                    checkCancelled();
                    ToolResult result = dispatch(call, scope, caller);
                    state.addToolResult(call, result.content());
                }
                state.moveTo(OrchestrationState.Phase.THINKING);
                reply = think(new ModelRequest(systemPrompt, state.conversation(), tools, caller.model()));
            }

            state.moveTo(OrchestrationState.Phase.ANSWERING);
            String rawAnswer = state.exhausted() ? partialAnswer(state) : Optional.ofNullable(reply.text()).orElse("");
            List<SourceRecord> structured = scope.drain();
            List<SourceRecord> sources = structured.isEmpty() ? LegacyCitationParser.parse(rawAnswer) : structured;
            String answer = LegacyCitationParser.strip(rawAnswer);

            checkCancelled();
            remember(session, userInput, answer);
            state.moveTo(OrchestrationState.Phase.DONE);

            log.info("Orchestration done: iterations={}, tools={}, sources={}, exhausted={}",
                    state.iterations(), state.toolsInvoked(), sources.size(), state.exhausted());
            return new OrchestrationOutcome(answer, sources, state.toolsInvoked(), state.iterations(), state.exhausted());
        } finally {
            scope.reset();
        }
    }

    private List<ConversationMessage> loadWindow(UserContext.ResolvedSession session) {
        if (session.temporary()) {
            return List.of();
        }
        List<ChatMemoryStore.StoredMessage> history = memoryStore.loadHistory(session.id());
        int maxMessages = settings.getMemoryWindow() * 2;
        int startIdx = Math.max(0, history.size() - maxMessages);

        List<ConversationMessage> window = new ArrayList<>();
        for (ChatMemoryStore.StoredMessage message : history.subList(startIdx, history.size())) {
            if (ChatMemoryStore.StoredMessage.ASSISTANT.equals(message.role())) {
                window.add(ConversationMessage.assistant(message.content()));
            } else {
                window.add(ConversationMessage.user(message.content()));
            }
        }
        return window;
    }

    private void remember(UserContext.ResolvedSession session, String userInput, String answer) {
        try {
            memoryStore.appendTurn(session.id(), userInput, answer, session.temporary());
        } catch (RuntimeException e) {
            // the answer is already computed; a lost memory entry only shortens the next window
            log.warn("Failed to append turn to session {}: {}", session.id(), e.getMessage());
        }
    }

    private ModelReply think(ModelRequest request) {
        checkCancelled();
        Duration timeout = settings.getModelTimeout();
        ModelReply reply;
        try {
            reply = withTimeout(() -> model.think(request), timeout);
        } catch (TimeoutException e) {
            throw new ModelUnavailableException("Chat model did not answer within " + timeout, e);
        }
        if (reply == null) {
            throw new ModelUnavailableException("Chat model returned no reply");
        }
        return reply;
    }

    private ToolResult dispatch(ToolCallRequest call, QueryScope scope, UserContext user) {
        Optional<AgentTool> tool = toolRegistry.findByName(call.name());
        if (tool.isEmpty()) {
            log.warn("Model requested unknown tool '{}'", call.name());
            return ToolResult.failure("Unknown tool: " + call.name());
        }

        JsonNode arguments;
        try {
            arguments = call.arguments() == null || call.arguments().isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(call.arguments());
        } catch (JsonProcessingException e) {
            log.warn("Malformed arguments for tool '{}': {}", call.name(), e.getOriginalMessage());
            return ToolResult.failure("Error: invalid arguments for tool " + call.name() + ": " + e.getOriginalMessage());
        }

        // sources land in the request scope only if the tool answers in time;
        // a timed-out tool may still be running and writes into an abandoned buffer
        QueryScope dispatchScope = new QueryScope();
        ToolInvocation invocation = new ToolInvocation(arguments, dispatchScope, user);
        Duration timeout = settings.getToolTimeout();
        log.info("Invoking tool '{}'", call.name());
        try {
            ToolResult result = withTimeout(() -> tool.get().execute(invocation), timeout);
            if (result == null) {
                return ToolResult.failure("Tool " + call.name() + " returned no result.");
            }
            scope.record(dispatchScope.drain());
            if (!result.success()) {
                log.warn("Tool '{}' reported a failure: {}", call.name(), result.content());
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("Tool '{}' timed out after {}", call.name(), timeout);
            return ToolResult.failure("Error: tool " + call.name() + " timed out after " + timeout.toSeconds() + "s.");
        } catch (RequestCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Tool '{}' failed: {}", call.name(), e.getMessage(), e);
            return ToolResult.failure("Error running tool " + call.name() + ": " + e.getMessage());
        }
    }

    /**
     * Run blocking work on boundedElastic and wait at most {@code timeout} for it.
     */
    private static <T> T withTimeout(Callable<T> work, Duration timeout) throws TimeoutException {
        try {
            return Mono.fromCallable(work)
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException timeoutException) {
                throw timeoutException;
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new RequestCancelledException("Request cancelled while waiting for a reply", cause);
            }
            throw e;
        }
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException("Request cancelled");
        }
    }

    private static String partialAnswer(OrchestrationState state) {
        if (state.lastModelText() != null) {
            return state.lastModelText();
        }
        if (state.lastToolResult() == null || state.lastToolResult().isBlank()) {
            return EXHAUSTED_NOTICE;
        }
        return EXHAUSTED_NOTICE + " Here is what I found so far:\n\n" + state.lastToolResult();
    }

    private static String buildSystemPrompt(UserContext user) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are Orin, an AI assistant for government and private offices. ")
                .append("Your primary goal is to help staff and citizens by providing accurate information ")
                .append("and resolving queries efficiently.\n\n");
        sb.append("Your capabilities include:\n")
                .append("1. Searching through official documents and policies\n")
                .append("2. Searching earlier conversations to keep answers consistent\n")
                .append("3. Fetching personalized user data when properly authenticated\n")
                .append("4. Formatting data into structured responses\n\n");
        sb.append("Guidelines:\n")
                .append("- Always prioritize accuracy and official information\n")
                .append("- For personalized requests, the user must be authenticated\n")
                .append("- If unsure, clearly state limitations and suggest alternatives\n")
                .append("- Keep responses concise but comprehensive\n")
                .append("- Do not list sources yourself; they are attached to the answer automatically\n\n");
        sb.append("User Context:");
        for (Map.Entry<String, String> entry : user.describe().entrySet()) {
            sb.append("\n- ").append(entry.getKey()).append(": ").append(entry.getValue());
        }
        return sb.toString();
    }
}
