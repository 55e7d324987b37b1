package com.example.Orin.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Caller identity and preferences for one query.
 *
 * @param userId     caller id, used to scope chat history
 * @param department caller department, recorded with chat history
 * @param authToken  credential forwarded to the user-data portal, may be null
 * @param sessionId  conversation id for memory separation; blank means a temporary session
 * @param model      optional model name hint (e.g. "deepseek", "openai")
 */
public record UserContext(
        String userId,
        String department,
        String authToken,
        String sessionId,
        String model
) {

    public static UserContext anonymous() {
        return new UserContext(null, null, null, null, null);
    }

    public boolean hasUserId() {
        return userId != null && !userId.isBlank();
    }

    public boolean hasAuthToken() {
        return authToken != null && !authToken.isBlank();
    }

    public ResolvedSession resolveSession() {
        boolean temporary = sessionId == null || sessionId.isBlank();
        String resolvedId = temporary ? "temp-" + UUID.randomUUID() : sessionId;
        return new ResolvedSession(resolvedId, temporary);
    }

    /**
     * Non-secret view of the context for prompt rendering. The token is never included.
     */
    public Map<String, String> describe() {
        Map<String, String> view = new LinkedHashMap<>();
        if (hasUserId()) {
            view.put("user_id", userId);
        }
        if (department != null && !department.isBlank()) {
            view.put("department", department);
        }
        view.put("authenticated", String.valueOf(hasAuthToken()));
        return view;
    }

    public record ResolvedSession(String id, boolean temporary) { }
}
