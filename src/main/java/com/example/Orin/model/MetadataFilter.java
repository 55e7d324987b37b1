package com.example.Orin.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Conjunction of exact-match constraints over chunk metadata.
 * <p>
 * Only {@code document_type}, {@code department}, {@code user_id} and {@code type}
 * may be constrained. Blank values impose no constraint.
 */
public record MetadataFilter(Map<String, String> constraints) {

    public static final Set<String> RECOGNIZED_KEYS = Set.of(
            MetadataKeys.DOCUMENT_TYPE,
            MetadataKeys.DEPARTMENT,
            MetadataKeys.USER_ID,
            MetadataKeys.TYPE
    );

    private static final MetadataFilter NONE = new MetadataFilter(Map.of());

    public MetadataFilter {
        Map<String, String> copy = new LinkedHashMap<>();
        if (constraints != null) {
            constraints.forEach((key, value) -> {
                if (!RECOGNIZED_KEYS.contains(key)) {
                    throw new IllegalArgumentException("Unsupported filter key: " + key);
                }
                if (value != null && !value.isBlank()) {
                    copy.put(key, value.trim());
                }
            });
        }
        constraints = Collections.unmodifiableMap(copy);
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter of(Map<String, String> constraints) {
        return new MetadataFilter(constraints);
    }

    /** Returns a copy with one more constraint; a blank value leaves the filter unchanged. */
    public MetadataFilter and(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(constraints);
        next.put(key, value);
        return new MetadataFilter(next);
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    /**
     * A list-valued metadata field matches when it contains the constrained value.
     */
    public boolean matches(Map<String, Object> metadata) {
        for (Map.Entry<String, String> constraint : constraints.entrySet()) {
            Object actual = metadata == null ? null : metadata.get(constraint.getKey());
            if (actual instanceof Collection<?> values) {
                boolean found = values.stream()
                        .anyMatch(v -> v != null && constraint.getValue().equals(v.toString()));
                if (!found) {
                    return false;
                }
            } else if (actual == null || !Objects.equals(constraint.getValue(), actual.toString())) {
                return false;
            }
        }
        return true;
    }
}
