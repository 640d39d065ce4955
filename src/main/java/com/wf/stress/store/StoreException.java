package com.wf.stress.store;

/**
 * Exception thrown when a store operation fails.
 * Wraps underlying driver exceptions.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
