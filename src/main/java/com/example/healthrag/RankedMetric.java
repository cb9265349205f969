package com.example.healthrag;

/**
 * A stored metric that matched a context query, with its search score.
 */
public class RankedMetric {

    private final HealthMetricView metric;
    private final double distance;
    private final double similarity;

    public RankedMetric(HealthMetricView metric, double distance, double similarity) {
        this.metric = metric;
        this.distance = distance;
        this.similarity = similarity;
    }

    public HealthMetricView getMetric() { return metric; }
    public double getDistance() { return distance; }
    public double getSimilarity() { return similarity; }
}
