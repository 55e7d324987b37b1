package com.example.Orin.repository;

import com.example.Orin.model.ChunkRecord;
import com.example.Orin.model.IndexedChunk;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.ScoredChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Embedded index kept in process memory. Used when no pgvector database is
 * configured and as the backing store for tests.
 */
public class InMemoryIndexStore implements IndexStore {

    private final int dimensions;
    private final List<Entry> entries = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long nextId = 1;

    public InMemoryIndexStore(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<String> add(List<ChunkRecord> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        chunks.forEach(this::checkDimensions);

        lock.writeLock().lock();
        try {
            List<String> ids = new ArrayList<>(chunks.size());
            for (ChunkRecord chunk : chunks) {
                long sequence = nextId++;
                String id = String.valueOf(sequence);
                entries.add(new Entry(sequence,
                        new IndexedChunk(id, chunk.text(), chunk.metadata()),
                        chunk.embedding().clone()));
                ids.add(id);
            }
            return ids;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ScoredChunk> search(float[] queryEmbedding, int k, MetadataFilter filter) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        if (queryEmbedding == null || queryEmbedding.length != dimensions) {
            throw new IllegalArgumentException("Query embedding must have " + dimensions + " dimensions");
        }
        MetadataFilter effective = filter == null ? MetadataFilter.none() : filter;

        List<Candidate> candidates = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Entry entry : entries) {
                if (effective.matches(entry.chunk().metadata())) {
                    candidates.add(new Candidate(entry, cosine(queryEmbedding, entry.embedding())));
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        return candidates.stream()
                .sorted(Comparator.comparingDouble(Candidate::score).reversed()
                        .thenComparingLong(c -> c.entry().sequence()))
                .limit(k)
                .map(c -> new ScoredChunk(c.entry().chunk(), c.score()))
                .toList();
    }

    @Override
    public int delete(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        Set<String> targets = new HashSet<>(ids);
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.removeIf(entry -> targets.contains(entry.chunk().id()));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void checkDimensions(ChunkRecord chunk) {
        if (chunk.embedding() == null || chunk.embedding().length != dimensions) {
            int actual = chunk.embedding() == null ? 0 : chunk.embedding().length;
            throw new IllegalArgumentException(
                    "Embedding has " + actual + " dimensions, index expects " + dimensions);
        }
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record Entry(long sequence, IndexedChunk chunk, float[] embedding) { }

    private record Candidate(Entry entry, double score) { }
}
