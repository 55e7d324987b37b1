package com.example.Orin.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * One citable source surfaced by a document search.
 * <p>
 * Record equality over all four fields is the deduplication key: two records
 * with the same filename, document type, department and source are the same citation.
 */
public record SourceRecord(
        String filename,
        @JsonProperty("document_type") String documentType,
        String department,
        String source
) {

    private static final String UNKNOWN = "unknown";

    public static SourceRecord ofFilename(String filename) {
        return new SourceRecord(filename, null, null, null);
    }

    /**
     * Build a record from chunk metadata. The filename comes from the
     * {@code filename} key, falling back to the last path segment of {@code source}.
     */
    public static Optional<SourceRecord> fromMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Optional.empty();
        }
        String source = asString(metadata.get(MetadataKeys.SOURCE));
        String filename = asString(metadata.get(MetadataKeys.FILENAME));
        if (filename == null && source != null) {
            filename = lastSegment(source);
        }
        SourceRecord record = new SourceRecord(
                filename,
                asString(metadata.get(MetadataKeys.DOCUMENT_TYPE)),
                asString(metadata.get(MetadataKeys.DEPARTMENT)),
                source
        );
        return record.hasUsableFilename() ? Optional.of(record) : Optional.empty();
    }

    public boolean hasUsableFilename() {
        return filename != null && !filename.isBlank() && !UNKNOWN.equalsIgnoreCase(filename.trim());
    }

    private static String lastSegment(String source) {
        try {
            Path fileName = Path.of(source).getFileName();
            return fileName == null ? null : fileName.toString();
        } catch (InvalidPathException ex) {
            int slash = Math.max(source.lastIndexOf('/'), source.lastIndexOf('\\'));
            return source.substring(slash + 1);
        }
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
