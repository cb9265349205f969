package com.example.healthrag;

/**
 * A search hit with its distance under the metric the search used.
 */
public final class ScoredRecord {

    private final IndexedRecord record;
    private final double distance;
    private final double similarity;

    public ScoredRecord(IndexedRecord record, double distance, double similarity) {
        this.record = record;
        this.distance = distance;
        this.similarity = similarity;
    }

    public IndexedRecord getRecord() { return record; }
    public double getDistance() { return distance; }
    public double getSimilarity() { return similarity; }
}
