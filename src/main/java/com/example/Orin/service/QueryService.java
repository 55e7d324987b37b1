package com.example.Orin.service;

import com.example.Orin.exception.RequestCancelledException;
import com.example.Orin.model.QueryResponse;
import com.example.Orin.model.UserContext;
import com.example.Orin.orchestration.OrchestrationOutcome;
import com.example.Orin.orchestration.ToolOrchestrator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of the chat surface:
 * - Runs the tool orchestrator for the question
 * - Records the exchange as searchable chat history (best effort)
 * - Turns fatal failures into an apology with {@code success=false}
 */
@Service
@RequiredArgsConstructor
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    public static final String APOLOGY =
            "I apologize, but I encountered an error while processing your request. Please try again later.";

    private final ToolOrchestrator orchestrator;
    private final ChatHistoryRecorder historyRecorder;

    public QueryResponse query(String userInput, UserContext user) {
        if (userInput == null || userInput.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        UserContext caller = user == null ? UserContext.anonymous() : user;

        OrchestrationOutcome outcome;
        try {
            outcome = orchestrator.run(userInput, caller);
        } catch (RequestCancelledException e) {
            log.info("Query cancelled: {}", e.getMessage());
            return QueryResponse.failure(APOLOGY, List.of(), "cancelled: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Query failed (length={}): {}", userInput.length(), e.getMessage(), e);
            return QueryResponse.failure(APOLOGY, List.of(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (caller.hasUserId() && !Thread.currentThread().isInterrupted()) {
            historyRecorder.record(userInput, outcome.answer(), caller.userId(), caller.department());
        }
        return QueryResponse.success(outcome.answer(), outcome.sources(), outcome.toolsInvoked());
    }
}
