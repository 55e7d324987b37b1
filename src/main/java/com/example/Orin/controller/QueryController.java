package com.example.Orin.controller;

import com.example.Orin.model.QueryRequest;
import com.example.Orin.model.QueryResponse;
import com.example.Orin.service.ChatMemoryStore;
import com.example.Orin.service.QueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orin")
@RequiredArgsConstructor
public class QueryController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final QueryService queryService;
    private final ChatMemoryStore chatMemoryStore;

    /**
     * Ask the assistant a question.
     * The Authorization header, when present, is forwarded to the user-data portal as-is.
     */
    @PostMapping("/query")
    public QueryResponse query(
            @RequestBody QueryRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        return queryService.query(request.message(), request.toUserContext(extractToken(authorization)));
    }

    /**
     * Forget the conversation memory of one session.
     */
    @DeleteMapping("/sessions/{sessionId}")
    public void clearSession(@PathVariable("sessionId") String sessionId) {
        chatMemoryStore.clear(sessionId);
    }

    static String extractToken(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return null;
        }
        String value = authorization.trim();
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            value = value.substring(BEARER_PREFIX.length()).trim();
        }
        return value.isEmpty() ? null : value;
    }
}
