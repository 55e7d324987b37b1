package com.example.Orin.service;

import com.example.Orin.exception.IndexUnavailableException;
import com.example.Orin.model.MetadataKeys;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatHistoryRecorderTest {

    private final DocumentIngestionService ingestionService = mock(DocumentIngestionService.class);
    private final ChatHistoryRecorder recorder = new ChatHistoryRecorder(ingestionService);

    @Test
    @SuppressWarnings("unchecked")
    void writesCombinedTextWithHistoryMetadata() {
        when(ingestionService.ingestText(anyString(), anyMap())).thenReturn(List.of("42"));

        ChatHistoryRecorder.ChatHistoryWrite write = recorder.record("How much leave?", "Twenty days.", "u-1", null);

        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(ingestionService).ingestText(eq("Query: How much leave?\nAnswer: Twenty days."), metadata.capture());
        assertThat(metadata.getValue())
                .containsEntry(MetadataKeys.TYPE, MetadataKeys.TYPE_CHAT_HISTORY)
                .containsEntry(MetadataKeys.USER_ID, "u-1")
                .containsEntry(MetadataKeys.DEPARTMENT, MetadataKeys.DEFAULT_DEPARTMENT)
                .containsKey(MetadataKeys.TIMESTAMP);
        assertThat(write.written()).isTrue();
        assertThat(write.chunkIds()).containsExactly("42");
    }

    @Test
    void failureIsReportedNotThrown() {
        when(ingestionService.ingestText(anyString(), anyMap()))
                .thenThrow(new IndexUnavailableException("index down"));

        ChatHistoryRecorder.ChatHistoryWrite write = recorder.record("q", "a", "u-1", "HR");

        assertThat(write.written()).isFalse();
        assertThat(write.error()).isEqualTo("index down");
        assertThat(write.chunkIds()).isEmpty();
    }
}
