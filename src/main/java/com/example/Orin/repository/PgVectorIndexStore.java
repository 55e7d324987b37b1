package com.example.Orin.repository;

import com.example.Orin.exception.IndexUnavailableException;
import com.example.Orin.model.ChunkRecord;
import com.example.Orin.model.IndexedChunk;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.ScoredChunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Index store on PostgreSQL + pgvector.
 * <p>
 * Uses the cosine distance operator {@code <=>} and reports similarity as
 * {@code 1 - distance}. Metadata lives in a JSONB column; a filter constraint matches
 * a scalar value or an array that contains it, as {@link MetadataFilter#matches} does.
 */
public class PgVectorIndexStore implements IndexStore {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndexStore.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final String table;
    private final int dimensions;

    public PgVectorIndexStore(JdbcTemplate jdbcTemplate,
                              TransactionTemplate transactionTemplate,
                              ObjectMapper objectMapper,
                              String table,
                              int dimensions) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid index table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.table = table;
        this.dimensions = dimensions;
    }

    @Override
    public List<String> add(List<ChunkRecord> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        List<Object[]> rows = new ArrayList<>(chunks.size());
        for (ChunkRecord chunk : chunks) {
            checkDimensions(chunk.embedding());
            rows.add(new Object[]{chunk.text(), writeMetadata(chunk.metadata()), new PGvector(chunk.embedding())});
        }

        String sql = "INSERT INTO " + table + " (content, metadata, embedding) "
                + "VALUES (?, CAST(? AS jsonb), ?) RETURNING id";
        try {
            List<String> ids = transactionTemplate.execute(status -> {
                List<String> assigned = new ArrayList<>(rows.size());
                for (Object[] row : rows) {
                    Long id = jdbcTemplate.queryForObject(sql, Long.class, row);
                    assigned.add(String.valueOf(id));
                }
                return assigned;
            });
            log.debug("Stored {} chunks in {}", rows.size(), table);
            return ids == null ? List.of() : ids;
        } catch (DataAccessException | TransactionException e) {
            throw new IndexUnavailableException("Failed to write " + rows.size() + " chunks to " + table, e);
        }
    }

    @Override
    public List<ScoredChunk> search(float[] queryEmbedding, int k, MetadataFilter filter) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        checkDimensions(queryEmbedding);
        PGvector queryVector = new PGvector(queryEmbedding);
        MetadataFilter effective = filter == null ? MetadataFilter.none() : filter;

        StringBuilder sql = new StringBuilder()
                .append("SELECT id, content, metadata, 1 - (embedding <=> ?) AS score FROM ")
                .append(table);
        List<Object> args = new ArrayList<>();
        args.add(queryVector);

        sql.append(whereClause(effective, args));
        sql.append(" ORDER BY embedding <=> ?, id LIMIT ?");
        args.add(queryVector);
        args.add(k);

        try {
            return jdbcTemplate.query(sql.toString(), new ScoredChunkRowMapper(), args.toArray());
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("Similarity search on " + table + " failed", e);
        }
    }

    /**
     * Filter predicates for {@code filter}, appending the bound values to {@code args}.
     * A scalar field matches on its text value, an array field when it contains the value.
     */
    static String whereClause(MetadataFilter filter, List<Object> args) {
        StringBuilder where = new StringBuilder();
        String joiner = " WHERE ";
        // keys are restricted to MetadataFilter.RECOGNIZED_KEYS, values are bound
        for (Map.Entry<String, String> constraint : filter.constraints().entrySet()) {
            String key = constraint.getKey();
            where.append(joiner)
                    .append("(metadata ->> '").append(key).append("' = ?")
                    .append(" OR metadata -> '").append(key).append("' @> jsonb_build_array(CAST(? AS text)))");
            args.add(constraint.getValue());
            args.add(constraint.getValue());
            joiner = " AND ";
        }
        return where.toString();
    }

    @Override
    public int delete(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        List<Object[]> batch = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                batch.add(new Object[]{Long.parseLong(id.trim())});
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid chunk id: " + id, e);
            }
        }
        try {
            int[] counts = jdbcTemplate.batchUpdate("DELETE FROM " + table + " WHERE id = ?", batch);
            int removed = 0;
            for (int count : counts) {
                removed += Math.max(count, 0);
            }
            return removed;
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("Failed to delete chunks from " + table, e);
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private void checkDimensions(float[] embedding) {
        int actual = embedding == null ? 0 : embedding.length;
        if (actual != dimensions) {
            throw new IllegalArgumentException(
                    "Embedding has " + actual + " dimensions, index expects " + dimensions);
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Chunk metadata is not serializable", e);
        }
    }

    private class ScoredChunkRowMapper implements RowMapper<ScoredChunk> {
        @Override
        public ScoredChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Object> metadata = Map.of();
            String metadataJson = rs.getString("metadata");
            if (metadataJson != null) {
                try {
                    metadata = objectMapper.readValue(metadataJson, METADATA_TYPE);
                } catch (JsonProcessingException e) {
                    // unreadable metadata only costs the citation, not the hit
                    log.warn("Unreadable metadata on chunk {}", rs.getLong("id"), e);
                }
            }
            IndexedChunk chunk = new IndexedChunk(
                    String.valueOf(rs.getLong("id")),
                    rs.getString("content"),
                    metadata
            );
            return new ScoredChunk(chunk, rs.getDouble("score"));
        }
    }
}
