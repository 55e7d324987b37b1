package com.example.Orin.service;

import com.example.Orin.model.MetadataKeys;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes finished exchanges back into the index as searchable chat history.
 * <p>
 * Best effort: a failed write is logged and reported in the result, never thrown,
 * so it cannot cost the user the answer.
 */
@Service
@RequiredArgsConstructor
public class ChatHistoryRecorder {

    private static final Logger log = LoggerFactory.getLogger(ChatHistoryRecorder.class);

    private final DocumentIngestionService ingestionService;

    public ChatHistoryWrite record(String query, String answer, String userId, String department) {
        String text = "Query: " + query + "\nAnswer: " + answer;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.TYPE, MetadataKeys.TYPE_CHAT_HISTORY);
        metadata.put(MetadataKeys.USER_ID, userId);
        metadata.put(MetadataKeys.DEPARTMENT,
                department == null || department.isBlank() ? MetadataKeys.DEFAULT_DEPARTMENT : department);
        metadata.put(MetadataKeys.TIMESTAMP, Instant.now().toString());

        try {
            List<String> ids = ingestionService.ingestText(text, metadata);
            log.debug("Recorded chat history for user {} ({} chunks)", userId, ids.size());
            return ChatHistoryWrite.success(ids);
        } catch (RuntimeException e) {
            log.warn("Failed to record chat history for user {}: {}", userId, e.getMessage(), e);
            return ChatHistoryWrite.failure(e.getMessage());
        }
    }

    /**
     * Outcome of a history write.
     */
    public record ChatHistoryWrite(boolean written, List<String> chunkIds, String error) {

        static ChatHistoryWrite success(List<String> chunkIds) {
            return new ChatHistoryWrite(true, List.copyOf(chunkIds), null);
        }

        static ChatHistoryWrite failure(String error) {
            return new ChatHistoryWrite(false, List.of(), error);
        }
    }
}
