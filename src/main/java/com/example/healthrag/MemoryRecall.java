package com.example.healthrag;

import java.time.Instant;

/**
 * A memory snippet ranked against a query vector.
 */
public class MemoryRecall {

    private final String text;
    private final double similarity;
    private final Instant lastUpdated;

    public MemoryRecall(String text, double similarity, Instant lastUpdated) {
        this.text = text;
        this.similarity = similarity;
        this.lastUpdated = lastUpdated;
    }

    public String getText() { return text; }
    public double getSimilarity() { return similarity; }
    public Instant getLastUpdated() { return lastUpdated; }
}
