package com.example.Orin.config;

import com.example.Orin.repository.InMemoryIndexStore;
import com.example.Orin.repository.IndexStore;
import com.example.Orin.repository.PgVectorIndexStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Selects the index backend from {@code orin.index.backend}.
 */
@Configuration
public class IndexConfig {

    private static final Logger log = LoggerFactory.getLogger(IndexConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "orin.index", name = "backend", havingValue = "pgvector", matchIfMissing = true)
    public IndexStore pgVectorIndexStore(JdbcTemplate jdbcTemplate,
                                         TransactionTemplate transactionTemplate,
                                         ObjectMapper objectMapper,
                                         OrinProperties properties) {
        OrinProperties.Index index = properties.getIndex();
        log.info("Using pgvector index store (table={}, dimensions={})", index.getTable(), index.getDimensions());
        return new PgVectorIndexStore(jdbcTemplate, transactionTemplate, objectMapper,
                index.getTable(), index.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(prefix = "orin.index", name = "backend", havingValue = "memory")
    public IndexStore inMemoryIndexStore(OrinProperties properties) {
        log.info("Using in-memory index store (dimensions={})", properties.getIndex().getDimensions());
        return new InMemoryIndexStore(properties.getIndex().getDimensions());
    }
}
