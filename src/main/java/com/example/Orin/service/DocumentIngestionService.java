package com.example.Orin.service;

import com.example.Orin.config.OrinProperties;
import com.example.Orin.exception.IndexUnavailableException;
import com.example.Orin.model.ChunkRecord;
import com.example.Orin.model.MetadataKeys;
import com.example.Orin.repository.IndexStore;
import com.example.Orin.service.loader.DocumentLoader;
import com.example.Orin.service.loader.DocumentLoaderRegistry;
import com.example.Orin.util.TextChunker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads, chunks, embeds and indexes documents.
 * <p>
 * Flow:
 *  1. Pick a loader by file extension (unknown extensions are rejected).
 *  2. Split the text into overlapping chunks.
 *  3. Attach metadata; caller-supplied fields override the defaults.
 *  4. Embed all chunks in one gateway call.
 *  5. Write the batch to the index store and return the assigned ids.
 * <p>
 * Embedding or index failures abort the whole call with
 * {@link com.example.Orin.exception.IndexUnavailableException}; no ids are returned
 * for content that was not stored.
 */
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);

    private final DocumentLoaderRegistry loaderRegistry;
    private final EmbeddingGateway embeddingGateway;
    private final IndexStore indexStore;
    private final OrinProperties properties;

    /**
     * Index an official document from the filesystem.
     *
     * @param extraMetadata optional fields merged over the defaults (e.g. a display {@code filename})
     * @return chunk ids assigned by the index store
     */
    public List<String> ingest(Path path,
                               String department,
                               String documentType,
                               Map<String, Object> extraMetadata) throws IOException {
        DocumentLoader loader = loaderRegistry.resolve(path);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.TYPE, MetadataKeys.TYPE_OFFICIAL_DOCUMENT);
        metadata.put(MetadataKeys.DOCUMENT_TYPE, documentType);
        metadata.put(MetadataKeys.DEPARTMENT, department);
        metadata.put(MetadataKeys.SOURCE, path.toString());
        metadata.put(MetadataKeys.FILENAME, path.getFileName().toString());
        if (extraMetadata != null) {
            metadata.putAll(extraMetadata);
        }

        log.info("Ingesting file: {} (size: {} bytes)", path.getFileName(), Files.size(path));
        String rawText = loader.load(path);
        return ingestText(rawText, metadata);
    }

    /**
     * Chunk, embed and index raw text.
     *
     * @param baseMetadata fields attached to every chunk; they win over the pipeline defaults
     */
    public List<String> ingestText(String rawContent, Map<String, Object> baseMetadata) {
        OrinProperties.Ingestion settings = properties.getIngestion();
        List<String> chunks = TextChunker.split(rawContent, settings.getChunkSize(), settings.getChunkOverlap());
        if (chunks.isEmpty()) {
            log.warn("No text to index (source={})", sourceOf(baseMetadata));
            return List.of();
        }

        List<float[]> vectors = embeddingGateway.embedAll(chunks);
        int expected = indexStore.dimensions();
        if (vectors.get(0).length != expected) {
            throw new IndexUnavailableException("Embedding model produces " + vectors.get(0).length
                    + " dimensions, index expects " + expected);
        }

        List<ChunkRecord> records = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(MetadataKeys.TYPE, MetadataKeys.TYPE_OFFICIAL_DOCUMENT);
            metadata.put(MetadataKeys.CHUNK_INDEX, i);
            if (baseMetadata != null) {
                metadata.putAll(baseMetadata);
            }
            metadata.values().removeIf(Objects::isNull);
            records.add(new ChunkRecord(chunks.get(i), vectors.get(i), metadata));
        }

        List<String> ids = indexStore.add(records);
        log.info("Indexed {} chunks (source={}, chunkSize={}, overlap={})",
                ids.size(), sourceOf(baseMetadata), settings.getChunkSize(), settings.getChunkOverlap());
        return ids;
    }

    /**
     * Remove chunks by the ids an earlier ingest returned.
     */
    public int delete(List<String> chunkIds) {
        int removed = indexStore.delete(chunkIds);
        log.info("Deleted {} of {} requested chunks", removed, chunkIds == null ? 0 : chunkIds.size());
        return removed;
    }

    private static Object sourceOf(Map<String, Object> metadata) {
        if (metadata == null) {
            return "-";
        }
        return metadata.getOrDefault(MetadataKeys.SOURCE, metadata.getOrDefault(MetadataKeys.TYPE, "-"));
    }
}
