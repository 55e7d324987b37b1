package com.example.Orin.model;

/**
 * Request payload for asking the assistant a question.
 *
 * @param message    user question
 * @param sessionId  chat session id for memory separation
 * @param userId     caller id
 * @param department caller department
 * @param model      optional model name hint (e.g. "deepseek", "openai")
 */
public record QueryRequest(
        String message,
        String sessionId,
        String userId,
        String department,
        String model
) {

    public UserContext toUserContext(String authToken) {
        return new UserContext(userId, department, authToken, sessionId, model);
    }
}
