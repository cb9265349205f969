package com.example.healthrag;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Deterministic local embedder: signed feature hashing of lower-cased word tokens into the
 * configured dimension, L2-normalized. Texts sharing words land close together, which is
 * enough for development and tests without a model runtime.
 */
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "false", matchIfMissing = true)
public class SimpleEmbeddingService implements EmbeddingService {

    private final int dimension;

    @Autowired
    public SimpleEmbeddingService(RetrievalProperties properties) {
        this(properties.getEmbeddingDimension());
    }

    SimpleEmbeddingService(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] v = new float[dimension];
        if (text == null) return v;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+")) {
            if (token.isEmpty()) continue;
            int h = mix(token.hashCode());
            int slot = Math.floorMod(h, dimension);
            v[slot] += (h & 0x40000000) == 0 ? 1f : -1f;
        }
        return VectorMath.normalize(v);
    }

    // murmur3 finalizer; spreads String.hashCode so nearby hashes do not share slots
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
