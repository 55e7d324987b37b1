package com.example.Orin.service;

import java.util.List;

/**
 * Per-session conversation window fed back to the model on each query.
 */
public interface ChatMemoryStore {

    /**
     * Load the latest messages of a session, oldest first.
     *
     * @throws com.example.Orin.exception.ConversationMemoryException when stored entries cannot be read
     */
    List<StoredMessage> loadHistory(String sessionId);

    /**
     * Append one exchange (user + assistant) and trim the session to the window.
     */
    void appendTurn(String sessionId, String userMessage, String assistantMessage, boolean temporary);

    void clear(String sessionId);

    record StoredMessage(String role, String content, long timestamp) {

        public static final String USER = "user";
        public static final String ASSISTANT = "assistant";
    }
}
