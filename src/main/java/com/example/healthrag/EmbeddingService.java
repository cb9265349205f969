package com.example.healthrag;

/**
 * Raw text embedding backend. Implementations must be deterministic for identical input.
 */
public interface EmbeddingService {

    /**
     * @throws EmbeddingUnavailableException if the model cannot be loaded or reached
     */
    float[] embed(String text);
}
