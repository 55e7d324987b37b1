package com.example.Orin.exception;

/** Thrown when the embedding gateway or the index store cannot be reached. */
public class IndexUnavailableException extends RuntimeException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getUserMessage() {
        return "The document index is temporarily unavailable. Please try again.";
    }
}
