package com.chainguru.ingestion.adapter;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;

/**
 * Protocol-specific throughput sampler. One implementation per chain family (or protocol inside a family).
 */
public interface SamplerAdapter {

    boolean supports(ChainTarget target);

    /**
     * Estimate TPS and lifetime transactions from one endpoint. Returns a SUCCESS result; any failure is thrown
     * ({@link SampleException} or {@link com.chainguru.ingestion.fetch.FetchException}) and turned into an ERROR by
     * the failover runner.
     */
    MeasurementResult sample(String endpoint, ChainTarget target);
}
