package com.wf.stress.store;

/**
 * The store did not report healthy within the allowed time.
 */
public class HealthTimeoutException extends StoreException {

    public HealthTimeoutException(String message) {
        super(message);
    }

    public HealthTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
