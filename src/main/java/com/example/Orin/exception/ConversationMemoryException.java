package com.example.Orin.exception;

/** Thrown when stored conversation memory for a session cannot be read back. */
public class ConversationMemoryException extends RuntimeException {

    private final String sessionId;

    public ConversationMemoryException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
