package com.example.healthrag;

import java.util.Arrays;

/**
 * Pure functions over embedding vectors. All binary operations require equal lengths.
 */
public final class VectorMath {

    private VectorMath() {}

    /**
     * Scales {@code v} to unit L2 norm. A zero vector is returned unchanged (same instance).
     */
    public static float[] normalize(float[] v) {
        double norm = norm(v);
        if (norm == 0.0) return v;
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) out[i] = (float) (v[i] / norm);
        return out;
    }

    public static double norm(float[] v) {
        double sum = 0;
        for (float f : v) sum += (double) f * f;
        return Math.sqrt(sum);
    }

    public static double dotProduct(float[] a, float[] b) {
        requireSameLength(a, b);
        double dot = 0;
        for (int i = 0; i < a.length; i++) dot += (double) a[i] * b[i];
        return dot;
    }

    /**
     * 1 - cosine similarity. Vectors with zero norm are treated as orthogonal to everything.
     */
    public static double cosineDistance(float[] a, float[] b) {
        requireSameLength(a, b);
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 1.0;
        double similarity = dot / (Math.sqrt(na) * Math.sqrt(nb));
        // clamp rounding drift so identical vectors land on exactly 0
        similarity = Math.max(-1.0, Math.min(1.0, similarity));
        return 1.0 - similarity;
    }

    public static double l2Distance(float[] a, float[] b) {
        requireSameLength(a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    public static void requireSameLength(float[] a, float[] b) {
        if (a == null || b == null) throw new IllegalArgumentException("vector must not be null");
        if (a.length != b.length) throw new DimensionMismatchException(a.length, b.length);
    }

    public static void requireDimension(float[] v, int dimension) {
        if (v == null) throw new IllegalArgumentException("vector must not be null");
        if (v.length != dimension) throw new DimensionMismatchException(dimension, v.length);
    }

    public static float[] copy(float[] v) {
        return Arrays.copyOf(v, v.length);
    }
}
