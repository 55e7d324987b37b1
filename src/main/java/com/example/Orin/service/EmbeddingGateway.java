package com.example.Orin.service;

import com.example.Orin.exception.IndexUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Thin wrapper over the remote embedding model. Any failure of the remote call
 * surfaces as {@link IndexUnavailableException}.
 */
@Service
@RequiredArgsConstructor
public class EmbeddingGateway {

    private final EmbeddingModel embeddingModel;

    public float[] embed(String text) {
        try {
            return embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new IndexUnavailableException("Embedding request failed", e);
        }
    }

    /**
     * Embed a batch in one remote call; the result lines up with {@code texts}.
     */
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors;
        try {
            vectors = embeddingModel.embed(texts);
        } catch (RuntimeException e) {
            throw new IndexUnavailableException("Embedding request failed for " + texts.size() + " chunks", e);
        }
        if (vectors == null || vectors.size() != texts.size()) {
            throw new IndexUnavailableException("Embedding model returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + texts.size() + " chunks");
        }
        return vectors;
    }
}
