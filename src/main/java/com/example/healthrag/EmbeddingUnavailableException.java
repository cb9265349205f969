package com.example.healthrag;

/**
 * The embedding model could not be loaded or reached. Fatal for a context build.
 */
public class EmbeddingUnavailableException extends RetrievalException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
