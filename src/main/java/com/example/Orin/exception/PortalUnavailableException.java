package com.example.Orin.exception;

/** Thrown when the internal user-data portal is unreachable or not configured. */
public class PortalUnavailableException extends RuntimeException {

    public PortalUnavailableException(String message) {
        super(message);
    }

    public PortalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
