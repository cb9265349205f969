package com.example.healthrag;

import com.github.jelmerk.hnswlib.core.DistanceFunction;
import com.github.jelmerk.hnswlib.core.DistanceFunctions;

import java.util.Locale;

/**
 * Supported dissimilarity measures. Lower distance always means more similar.
 */
public enum DistanceMetric {

    COSINE {
        @Override
        public double distance(float[] a, float[] b) {
            return VectorMath.cosineDistance(a, b);
        }

        @Override
        public double maxDistanceFor(double minSimilarity) {
            return 1.0 - minSimilarity;
        }

        @Override
        public double similarityOf(double distance) {
            return 1.0 - distance;
        }

        @Override
        public DistanceFunction<float[], Float> hnswFunction() {
            return DistanceFunctions.FLOAT_COSINE_DISTANCE;
        }
    },

    /** Euclidean distance. Threshold conversion assumes unit-length vectors. */
    L2 {
        @Override
        public double distance(float[] a, float[] b) {
            return VectorMath.l2Distance(a, b);
        }

        @Override
        public double maxDistanceFor(double minSimilarity) {
            return Math.sqrt(Math.max(0.0, 2.0 * (1.0 - minSimilarity)));
        }

        @Override
        public double similarityOf(double distance) {
            return 1.0 - (distance * distance) / 2.0;
        }

        @Override
        public DistanceFunction<float[], Float> hnswFunction() {
            return DistanceFunctions.FLOAT_EUCLIDEAN_DISTANCE;
        }
    },

    /** Negative dot product, so that smaller is better like the other metrics. */
    INNER_PRODUCT {
        @Override
        public double distance(float[] a, float[] b) {
            return -VectorMath.dotProduct(a, b);
        }

        @Override
        public double maxDistanceFor(double minSimilarity) {
            return -minSimilarity;
        }

        @Override
        public double similarityOf(double distance) {
            return -distance;
        }

        @Override
        public DistanceFunction<float[], Float> hnswFunction() {
            // 1 - dot: same ordering as -dot
            return DistanceFunctions.FLOAT_INNER_PRODUCT;
        }
    };

    public abstract double distance(float[] a, float[] b);

    /**
     * Distance cutoff equivalent to a minimum similarity in [0, 1].
     */
    public abstract double maxDistanceFor(double minSimilarity);

    public abstract double similarityOf(double distance);

    public abstract DistanceFunction<float[], Float> hnswFunction();

    public static DistanceMetric fromName(String name) {
        if (name == null || name.isBlank()) return COSINE;
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "cosine":
                return COSINE;
            case "l2":
            case "euclidean":
                return L2;
            case "inner":
            case "inner_product":
            case "dot":
                return INNER_PRODUCT;
            default:
                throw new IllegalArgumentException("unknown distance metric: " + name);
        }
    }
}
