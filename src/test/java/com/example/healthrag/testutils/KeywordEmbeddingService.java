package com.example.healthrag.testutils;

import com.example.healthrag.EmbeddingService;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic embedder for tests: every registered keyword owns one axis and a text's vector
 * counts the keywords it contains. Text without any keyword lands on the last axis.
 */
public class KeywordEmbeddingService implements EmbeddingService {

    private final int dimension;
    private final Map<String, Integer> axes = new HashMap<>();

    public KeywordEmbeddingService(int dimension, String... keywords) {
        if (keywords.length >= dimension) throw new IllegalArgumentException("too many keywords for dimension " + dimension);
        this.dimension = dimension;
        for (int i = 0; i < keywords.length; i++) axes.put(keywords[i], i);
    }

    @Override
    public float[] embed(String text) {
        float[] v = new float[dimension];
        boolean any = false;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z_]+")) {
            Integer axis = axes.get(token);
            if (axis != null) {
                v[axis] += 1f;
                any = true;
            }
        }
        if (!any) v[dimension - 1] = 1f;
        return v;
    }
}
