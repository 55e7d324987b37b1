package com.example.Orin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds the {@code orin.*} properties from application.yml.
 */
@Data
@ConfigurationProperties(prefix = "orin")
public class OrinProperties {

    private Ingestion ingestion = new Ingestion();
    private Index index = new Index();
    private Retrieval retrieval = new Retrieval();
    private Orchestrator orchestrator = new Orchestrator();
    private Memory memory = new Memory();
    private Portal portal = new Portal();

    @Data
    public static class Ingestion {
        /** Target chunk size in characters. */
        private int chunkSize = 1000;
        /** Characters shared between neighbouring chunks of one document. */
        private int chunkOverlap = 100;
    }

    @Data
    public static class Index {
        /** "pgvector" or "memory". */
        private String backend = "pgvector";
        /** Embedding dimensionality every stored vector must match. */
        private int dimensions = 1024;
        private String table = "orin_chunks";
    }

    @Data
    public static class Retrieval {
        private int documentTopK = 3;
        private int historyTopK = 2;
        private int documentPreviewLength = 300;
        private int historyPreviewLength = 200;
    }

    @Data
    public static class Orchestrator {
        private int maxIterations = 3;
        /** Number of most recent exchanges (user + assistant) fed back to the model. */
        private int memoryWindow = 5;
        private Duration toolTimeout = Duration.ofSeconds(10);
        private Duration modelTimeout = Duration.ofSeconds(60);
        private String defaultModel = "deepseek";
    }

    @Data
    public static class Memory {
        /** "redis" or "memory". */
        private String backend = "redis";
        private Duration sessionTtl = Duration.ofDays(7);
        private Duration temporaryTtl = Duration.ofMinutes(1);
    }

    @Data
    public static class Portal {
        /** Base URL of the internal user-data portal; blank means not configured. */
        private String baseUrl = "";
        private String apiKey = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }
}
