package com.chainguru.ingestion.fetch;

/**
 * Thrown when an outbound fetch fails: blocked URL, timeout, transport error or non-2xx status.
 * The message is a short diagnostic suitable for persisting as the target's error detail.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
