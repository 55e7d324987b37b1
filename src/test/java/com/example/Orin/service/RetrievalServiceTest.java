package com.example.Orin.service;

import com.example.Orin.exception.IndexUnavailableException;
import com.example.Orin.model.ChunkRecord;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.MetadataKeys;
import com.example.Orin.model.SearchHit;
import com.example.Orin.repository.InMemoryIndexStore;
import com.example.Orin.repository.IndexStore;
import com.example.Orin.support.KeywordEmbeddingModel;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetrievalServiceTest {

    private final EmbeddingGateway gateway = new EmbeddingGateway(new KeywordEmbeddingModel());

    @Test
    void unavailableIndexYieldsEmptyResult() {
        IndexStore broken = mock(IndexStore.class);
        when(broken.dimensions()).thenReturn(KeywordEmbeddingModel.DIMENSIONS);
        when(broken.search(any(), anyInt(), any())).thenThrow(new IndexUnavailableException("db down"));

        assertThat(new RetrievalService(gateway, broken).search("annual leave", 3, MetadataFilter.none())).isEmpty();
    }

    @Test
    void unavailableEmbeddingModelYieldsEmptyResult() {
        EmbeddingModel failing = mock(EmbeddingModel.class);
        when(failing.embed(anyString())).thenThrow(new IllegalStateException("timeout"));
        RetrievalService service = new RetrievalService(new EmbeddingGateway(failing), new InMemoryIndexStore(16));

        assertThat(service.search("annual leave", 3, null)).isEmpty();
    }

    @Test
    void queryEmbeddingOfWrongSizeYieldsEmptyResult() {
        EmbeddingModel wrongSize = mock(EmbeddingModel.class);
        when(wrongSize.embed(anyString())).thenReturn(new float[]{1f, 0f, 0f});
        InMemoryIndexStore store = new InMemoryIndexStore(KeywordEmbeddingModel.DIMENSIONS);
        store.add(List.of(record("annual leave policy", Map.of(MetadataKeys.TYPE, MetadataKeys.TYPE_OFFICIAL_DOCUMENT))));

        assertThat(new RetrievalService(new EmbeddingGateway(wrongSize), store).search("annual leave", 3, null)).isEmpty();
    }

    @Test
    void blankQueryFindsNothingAndNonPositiveKIsRejected() {
        RetrievalService service = new RetrievalService(gateway, new InMemoryIndexStore(16));

        assertThat(service.search(" ", 3, null)).isEmpty();
        assertThatThrownBy(() -> service.search("leave", 0, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void documentSearchSkipsChatHistoryAndAppliesFilters() {
        InMemoryIndexStore store = new InMemoryIndexStore(KeywordEmbeddingModel.DIMENSIONS);
        store.add(List.of(
                record("annual leave policy", Map.of(MetadataKeys.TYPE, MetadataKeys.TYPE_OFFICIAL_DOCUMENT,
                        MetadataKeys.DEPARTMENT, "HR")),
                record("Query: annual leave\nAnswer: twenty days", Map.of(MetadataKeys.TYPE, MetadataKeys.TYPE_CHAT_HISTORY,
                        MetadataKeys.DEPARTMENT, "HR")),
                record("annual leave for contractors", Map.of(MetadataKeys.TYPE, MetadataKeys.TYPE_OFFICIAL_DOCUMENT,
                        MetadataKeys.DEPARTMENT, "Legal"))));

        List<SearchHit> hits = new RetrievalService(gateway, store).searchDocuments("annual leave", 5, "HR", null);

        assertThat(hits).extracting(SearchHit::preview).containsExactly("annual leave policy");
    }

    @Test
    void previewMarksCut() {
        assertThat(RetrievalService.preview("abcdef", 3)).isEqualTo("abc...");
        assertThat(RetrievalService.preview("abc", 3)).isEqualTo("abc");
        assertThat(RetrievalService.preview(null, 3)).isEmpty();
    }

    private static ChunkRecord record(String text, Map<String, Object> metadata) {
        return new ChunkRecord(text, KeywordEmbeddingModel.vectorOf(text), metadata);
    }
}
