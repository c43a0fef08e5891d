package com.kotsin.stdev.state;

/**
 * Persisted window state could not be read, validated or written.
 *
 * Always fatal for the batch: continuing with empty state would silently reset every window.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
