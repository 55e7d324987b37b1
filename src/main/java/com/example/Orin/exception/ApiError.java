package com.example.Orin.exception;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

    public static final String UNSUPPORTED_FORMAT = "DOCUMENT_001";
    public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_002";
    public static final String INDEX_UNAVAILABLE = "INDEX_001";
    public static final String VALIDATION_ERROR = "VALIDATION_001";

    /** Unique error ID for log correlation. */
    private final String errorId;

    private final String code;

    /** User-friendly error message. */
    private final String message;

    private final Instant timestamp;

    private final String path;
}
