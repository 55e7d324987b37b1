package com.example.Orin.model;

import java.util.Map;

/**
 * A chunk as read back from the index, identified by its store-assigned id.
 */
public record IndexedChunk(
        String id,
        String text,
        Map<String, Object> metadata
) {
    public Object metadataValue(String key) {
        return metadata == null ? null : metadata.get(key);
    }
}
