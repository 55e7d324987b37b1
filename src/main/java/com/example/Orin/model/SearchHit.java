package com.example.Orin.model;

import java.util.Map;

/**
 * A retrieval hit trimmed for display: preview text, score and metadata.
 */
public record SearchHit(
        String id,
        String preview,
        double score,
        Map<String, Object> metadata
) {
}
