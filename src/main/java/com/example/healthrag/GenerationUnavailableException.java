package com.example.healthrag;

/**
 * The text generator failed or produced no output.
 */
public class GenerationUnavailableException extends RetrievalException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
