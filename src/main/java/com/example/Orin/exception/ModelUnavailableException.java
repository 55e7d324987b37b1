package com.example.Orin.exception;

/** Thrown when the generative model cannot be reached or does not answer in time. */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
