package com.example.Orin.service;

import com.example.Orin.exception.IndexUnavailableException;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.MetadataKeys;
import com.example.Orin.model.ScoredChunk;
import com.example.Orin.model.SearchHit;
import com.example.Orin.repository.IndexStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Retrieval-only service:
 * - Embeds the query
 * - Runs a filtered similarity search on the index store
 * - Returns hits best-first, at most {@code k} of them
 *
 * This service does NOT call any chat/LLM APIs. An unreachable index or
 * embedding model yields an empty result rather than an error, so callers can
 * still answer without citations.
 */
@Service
@RequiredArgsConstructor
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    /** Preview length used for direct (non-agent) searches. */
    private static final int SEARCH_PREVIEW_LENGTH = 500;

    private final EmbeddingGateway embeddingGateway;
    private final IndexStore indexStore;

    /**
     * @param k      maximum number of hits, must be positive
     * @param filter exact-match metadata constraints, may be {@code null}
     */
    public List<ScoredChunk> search(String query, int k, MetadataFilter filter) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }
        MetadataFilter effective = filter == null ? MetadataFilter.none() : filter;

        List<ScoredChunk> hits;
        try {
            float[] queryEmbedding = embeddingGateway.embed(query);
            int expected = indexStore.dimensions();
            if (queryEmbedding == null || queryEmbedding.length != expected) {
                throw new IndexUnavailableException("Query embedding has "
                        + (queryEmbedding == null ? 0 : queryEmbedding.length)
                        + " dimensions, index expects " + expected);
            }
            hits = indexStore.search(queryEmbedding, k, effective);
        } catch (IndexUnavailableException e) {
            log.warn("Retrieval unavailable, returning no results (filter={}): {}",
                    effective.constraints(), e.getMessage());
            return List.of();
        }

        if (hits == null || hits.isEmpty()) {
            log.debug("Retrieval: no documents found (filter={})", effective.constraints());
            return List.of();
        }
        log.debug("Retrieval: {} hits, top score {} (filter={})",
                hits.size(), hits.get(0).score(), effective.constraints());
        return hits.size() > k ? List.copyOf(hits.subList(0, k)) : hits;
    }

    /**
     * Direct search over official documents for the admin surface.
     */
    public List<SearchHit> searchDocuments(String query, int limit, String department, String documentType) {
        MetadataFilter filter = MetadataFilter.none()
                .and(MetadataKeys.TYPE, MetadataKeys.TYPE_OFFICIAL_DOCUMENT)
                .and(MetadataKeys.DEPARTMENT, department)
                .and(MetadataKeys.DOCUMENT_TYPE, documentType);
        return search(query, limit, filter).stream()
                .map(hit -> new SearchHit(
                        hit.chunk().id(),
                        preview(hit.chunk().text(), SEARCH_PREVIEW_LENGTH),
                        hit.score(),
                        hit.chunk().metadata()))
                .toList();
    }

    /**
     * Cut text to {@code maxLength} characters, marking the cut with "...".
     */
    public static String preview(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
