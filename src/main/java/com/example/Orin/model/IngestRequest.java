package com.example.Orin.model;

import java.util.Map;

/**
 * Request to index a document already present on the server's filesystem.
 */
public record IngestRequest(
        String path,
        String department,
        String documentType,
        Map<String, Object> extraMetadata
) {
}
