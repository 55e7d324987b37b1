package com.example.Orin.repository;

import com.example.Orin.model.ChunkRecord;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.ScoredChunk;

import java.util.List;

/**
 * Persistent (text, embedding, metadata) triples with filtered nearest-neighbour search.
 * <p>
 * Writes are append-only. Implementations throw
 * {@link com.example.Orin.exception.IndexUnavailableException} when the backend
 * cannot be reached and {@link IllegalArgumentException} when an embedding does not
 * match {@link #dimensions()}.
 */
public interface IndexStore {

    /**
     * Write all chunks as one batch; either every chunk is stored or none is.
     *
     * @return store-assigned ids, in input order
     */
    List<String> add(List<ChunkRecord> chunks);

    /**
     * Cosine-similarity search restricted to chunks matching every filter constraint.
     * Results are ordered by descending score, ties broken by insertion order.
     *
     * @param k maximum number of hits, must be positive
     */
    List<ScoredChunk> search(float[] queryEmbedding, int k, MetadataFilter filter);

    /**
     * Remove chunks by id. Unknown ids are ignored.
     *
     * @return number of chunks removed
     */
    int delete(List<String> ids);

    int dimensions();
}
