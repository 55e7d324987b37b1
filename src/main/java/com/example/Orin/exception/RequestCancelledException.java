package com.example.Orin.exception;

/** Thrown when the calling thread is interrupted while a request is in flight. */
public class RequestCancelledException extends RuntimeException {

    public RequestCancelledException(String message) {
        super(message);
    }

    public RequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
