package com.example.healthrag;

/**
 * The response cache could not be read or written. Callers treat this as a miss.
 */
public class CacheUnavailableException extends RetrievalException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
