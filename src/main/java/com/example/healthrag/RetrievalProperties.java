package com.example.healthrag;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Static tuning for embedding, search, memory and cache. Bound from {@code retrieval.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {

    /**
     * Length of every embedding vector produced by this deployment.
     */
    private int embeddingDimension = 384;

    /**
     * Minimum similarity a metric record needs to be included in a context.
     */
    private double similarityThreshold = 0.7;

    /**
     * Cap on records returned per category.
     */
    private int maxMetricsPerType = 5;

    private Memory memory = new Memory();

    private Cache cache = new Cache();

    /**
     * Threads used to run per-category searches of one context build.
     */
    private int searchThreads = 4;

    @Data
    public static class Memory {

        /**
         * Upper bound on the rendered memory document, in characters.
         */
        private int maxChars = 10_000;

        /**
         * Most recent insights included in a context.
         */
        private int maxInsights = 10;

        private int recallLimit = 3;

        private double recallMinSimilarity = 0.6;
    }

    @Data
    public static class Cache {

        private long defaultTtlHours = 24;
    }
}
