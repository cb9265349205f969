package com.example.healthrag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Entry point for turning text and structured records into fixed-length vectors, plus the
 * distance helpers the rest of the engine uses.
 *
 * <p>The backing {@link EmbeddingService} is injected rather than loaded globally. A real model
 * backend is expensive to start (model download and warm-up happen on first use of the
 * backend), so the generator should be created once per application context and shared.
 * Tests can construct it over a fake embedder.
 *
 * <p>Every vector leaving this class has exactly {@link #dimension()} components.
 */
@Component
public class EmbeddingGenerator {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingGenerator.class);

    private final EmbeddingService embeddingService;
    private final int dimension;

    @Autowired
    public EmbeddingGenerator(EmbeddingService embeddingService, RetrievalProperties properties) {
        this(embeddingService, properties.getEmbeddingDimension());
    }

    public EmbeddingGenerator(EmbeddingService embeddingService, int dimension) {
        if (dimension <= 0) throw new IllegalArgumentException("embedding dimension must be positive");
        this.embeddingService = embeddingService;
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }

    /**
     * @throws EmbeddingUnavailableException if the backend fails or returns nothing
     * @throws DimensionMismatchException if the backend returns a vector of the wrong length
     */
    public float[] embed(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        float[] v;
        try {
            v = embeddingService.embed(text);
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("embedding backend failed: " + e.getMessage(), e);
        }
        if (v == null) throw new EmbeddingUnavailableException("embedding backend returned no vector");
        VectorMath.requireDimension(v, dimension);
        log.debug("embedded {} chars", text.length());
        return VectorMath.copy(v);
    }

    /**
     * Embeds a record through its canonical text, see {@link CanonicalRecordText}.
     */
    public float[] embedStructuredRecord(String category, Map<String, ?> fields, String source) {
        return embed(CanonicalRecordText.render(category, fields, source));
    }

    public float[] embedMetric(MetricValue value, String source) {
        return embedStructuredRecord(value.category(), value.toFields(), source);
    }

    public float[] normalize(float[] v) {
        return VectorMath.normalize(v);
    }

    public double cosineDistance(float[] a, float[] b) {
        return VectorMath.cosineDistance(a, b);
    }

    public double l2Distance(float[] a, float[] b) {
        return VectorMath.l2Distance(a, b);
    }

    public double dotProduct(float[] a, float[] b) {
        return VectorMath.dotProduct(a, b);
    }
}
