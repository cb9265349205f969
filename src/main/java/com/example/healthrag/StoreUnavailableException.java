package com.example.healthrag;

/**
 * The durable store (or the index backed by it) failed while serving a read or write.
 */
public class StoreUnavailableException extends RetrievalException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
