package com.chainguru.ingestion.adapter;

/**
 * Sampling could not produce an estimate (e.g. "no_start_block", "no_valid_samples"). The message is the reason
 * recorded on the ERROR result.
 */
public class SampleException extends RuntimeException {

    public static final String NO_START_BLOCK = "no_start_block";
    public static final String NO_VALID_SAMPLES = "no_valid_samples";

    public SampleException(String reason) {
        super(reason);
    }

    public SampleException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
