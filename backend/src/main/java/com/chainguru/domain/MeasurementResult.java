package com.chainguru.domain;

import java.time.Instant;

/**
 * Outcome of sampling one target in one run. Created once, never mutated.
 * Invariants: SUCCESS requires a TPS estimate and no error detail; any other status requires an error detail;
 * estimates are never negative.
 */
public record MeasurementResult(String chainId,
                                String chainName,
                                String endpointUsed,
                                Double tpsEstimate,
                                Double totalTxEstimate,
                                MeasurementStatus status,
                                String errorDetail,
                                MeasurementSource source,
                                Instant observedAt) {

    public static final String HEALTH_LIVE = "Live";
    public static final String HEALTH_LIVE_SCRAPED = "Live (Scraped)";

    public MeasurementResult {
        if (chainId == null || chainId.isBlank()) {
            throw new IllegalArgumentException("chainId is required");
        }
        if (status == null || observedAt == null) {
            throw new IllegalArgumentException("status and observedAt are required");
        }
        if (status == MeasurementStatus.SUCCESS) {
            if (tpsEstimate == null || errorDetail != null) {
                throw new IllegalArgumentException("SUCCESS requires tpsEstimate and no errorDetail");
            }
            if (source == null) {
                source = MeasurementSource.PROTOCOL_RPC;
            }
        } else if (errorDetail == null) {
            throw new IllegalArgumentException(status + " requires errorDetail");
        }
        requireNonNegative("tpsEstimate", tpsEstimate);
        requireNonNegative("totalTxEstimate", totalTxEstimate);
    }

    public static MeasurementResult success(ChainTarget target, String endpoint, double tps, Double totalTx) {
        return new MeasurementResult(target.chainId(), target.chainName(), endpoint, tps, totalTx,
                MeasurementStatus.SUCCESS, null, MeasurementSource.PROTOCOL_RPC, Instant.now());
    }

    /** Values read from the explorer page; no RPC endpoint was used. */
    public static MeasurementResult pageInspection(ChainTarget target, double tps, Double totalTx) {
        return new MeasurementResult(target.chainId(), target.chainName(), null, tps, totalTx,
                MeasurementStatus.SUCCESS, null, MeasurementSource.PAGE_INSPECTION, Instant.now());
    }

    public static MeasurementResult error(ChainTarget target, String errorDetail) {
        return new MeasurementResult(target.chainId(), target.chainName(), null, null, null,
                MeasurementStatus.ERROR, errorDetail, null, Instant.now());
    }

    public static MeasurementResult skipped(ChainTarget target, String reason) {
        return new MeasurementResult(target.chainId(), target.chainName(), null, null, null,
                MeasurementStatus.SKIPPED, reason, null, Instant.now());
    }

    public boolean isSuccess() {
        return status == MeasurementStatus.SUCCESS;
    }

    /**
     * Human-readable health label persisted next to the status: "Live", "Live (Scraped)" or the error detail.
     */
    public String healthLabel() {
        if (!isSuccess()) {
            return errorDetail;
        }
        return source == MeasurementSource.PAGE_INSPECTION ? HEALTH_LIVE_SCRAPED : HEALTH_LIVE;
    }

    private static void requireNonNegative(String name, Double value) {
        if (value != null && (value.isNaN() || value < 0)) {
            throw new IllegalArgumentException(name + " must be a non-negative number: " + value);
        }
    }
}
