package com.chainguru.ingestion.registry;

/**
 * A target source could not be read. Aborts the run before any target is measured.
 */
public class RegistryUnavailableException extends RuntimeException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
