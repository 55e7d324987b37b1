package com.example.Orin.exception;

/** Thrown when personalised data is requested without a caller credential. */
public class AuthenticationRequiredException extends RuntimeException {

    public static final String MISSING_CREDENTIAL =
            "Authentication required to access personalized data. Please provide valid credentials.";

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
