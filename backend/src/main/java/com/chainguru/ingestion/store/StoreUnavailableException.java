package com.chainguru.ingestion.store;

/**
 * The metrics database could not be reached or rejected a write. Aborts the current run.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
