package com.chainguru.domain;

import java.util.Locale;

/**
 * Outcome of one measurement. Persisted as the lower-case wire value ("success", "error", "skipped") that external
 * readers of chain_metrics filter on.
 */
public enum MeasurementStatus {
    SUCCESS,
    ERROR,
    SKIPPED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MeasurementStatus fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
