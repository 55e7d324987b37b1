package com.example.Orin.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.UUID;

/** Maps ingestion and search failures to HTTP responses. */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<ApiError> handleUnsupportedFormat(
            UnsupportedFormatException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Unsupported format [{}]: {}", errorId, ex.getExtension());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.UNSUPPORTED_FORMAT, ex.getUserMessage(), request);
    }

    @ExceptionHandler(NoSuchFileException.class)
    public ResponseEntity<ApiError> handleMissingFile(NoSuchFileException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Document not found [{}]: {}", errorId, ex.getFile());
        return build(HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
    }

    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<ApiError> handleIndexUnavailable(
            IndexUnavailableException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Index unavailable [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.INDEX_UNAVAILABLE, ex.getUserMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String errorId, String code,
                                           String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ApiError.builder()
                        .errorId(errorId)
                        .code(code)
                        .message(message)
                        .path(request.getRequestURI())
                        .timestamp(Instant.now())
                        .build());
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
