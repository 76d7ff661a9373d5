package com.chainguru.ingestion.adapter.solana;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.SampleException;
import com.chainguru.ingestion.adapter.SamplerAdapter;
import com.chainguru.ingestion.config.SamplingProperties;
import com.chainguru.ingestion.fetch.FetchException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Solana publishes throughput directly: getRecentPerformanceSamples gives transactions per sample period, and
 * getTransactionCount the lifetime total. No block window is needed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SolanaSampler implements SamplerAdapter {

    public static final String PROTOCOL = "solana";

    private final ChainDataClient client;
    private final SamplingProperties samplingProperties;

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.CUSTOM && PROTOCOL.equals(target.protocol());
    }

    @Override
    public MeasurementResult sample(String endpoint, ChainTarget target) {
        int limit = Math.max(1, samplingProperties.getSolana().getPerformanceSamples());
        JsonNode samples = client.call(endpoint, "getRecentPerformanceSamples", List.of(limit));
        if (!samples.isArray() || samples.isEmpty()) {
            throw new SampleException("no_performance_samples");
        }
        long transactions = 0;
        long seconds = 0;
        for (JsonNode sample : samples) {
            transactions += sample.path("numTransactions").asLong();
            seconds += sample.path("samplePeriodSecs").asLong();
        }
        if (seconds <= 0) {
            throw new SampleException("zero_sample_time");
        }
        return MeasurementResult.success(target, endpoint, (double) transactions / seconds, transactionCount(endpoint));
    }

    private Double transactionCount(String endpoint) {
        try {
            JsonNode count = client.call(endpoint, "getTransactionCount", List.of());
            return count.isNumber() ? count.asDouble() : null;
        } catch (FetchException e) {
            log.debug("getTransactionCount failed at {}: {}", endpoint, e.getMessage());
            return null;
        }
    }
}
