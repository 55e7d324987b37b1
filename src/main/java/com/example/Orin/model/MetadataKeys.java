package com.example.Orin.model;

/**
 * Metadata field names stored alongside every indexed chunk.
 */
public final class MetadataKeys {

    private MetadataKeys() {
    }

    public static final String TYPE = "type";
    public static final String DOCUMENT_TYPE = "document_type";
    public static final String DEPARTMENT = "department";
    public static final String SOURCE = "source";
    public static final String FILENAME = "filename";
    public static final String USER_ID = "user_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String CHUNK_INDEX = "chunk_index";

    public static final String TYPE_OFFICIAL_DOCUMENT = "official_document";
    public static final String TYPE_CHAT_HISTORY = "chat_history";

    public static final String DEFAULT_DEPARTMENT = "general";
}
