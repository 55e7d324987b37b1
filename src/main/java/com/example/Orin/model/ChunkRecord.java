package com.example.Orin.model;

import java.util.Map;

/**
 * A chunk ready to be written to the index: text, its embedding and metadata.
 */
public record ChunkRecord(
        String text,
        float[] embedding,
        Map<String, Object> metadata
) {
    public ChunkRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
