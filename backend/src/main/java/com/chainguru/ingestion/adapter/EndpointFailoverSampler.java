package com.chainguru.ingestion.adapter;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.ingestion.adapter.page.PageInspectionSampler;
import com.chainguru.ingestion.fetch.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Measures one target: picks the sampler for its family, tries candidate endpoints in registry order until one
 * succeeds, then falls back to explorer page inspection. Never throws; every outcome is a result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EndpointFailoverSampler {

    public static final String NO_CANDIDATE_ENDPOINT = "no_candidate_endpoint";
    public static final String UNSUPPORTED_PROTOCOL_FAMILY = "unsupported_protocol_family";
    public static final String INTERRUPTED = "interrupted";

    private final List<SamplerAdapter> samplers;
    private final PageInspectionSampler pageInspectionSampler;

    public Optional<SamplerAdapter> findSampler(ChainTarget target) {
        if (target.protocolFamily() == null) {
            return Optional.empty();
        }
        return samplers.stream().filter(s -> s.supports(target)).findFirst();
    }

    public MeasurementResult measure(ChainTarget target) {
        if (!target.hasCandidateEndpoints()) {
            return MeasurementResult.skipped(target, NO_CANDIDATE_ENDPOINT);
        }
        Optional<SamplerAdapter> sampler = findSampler(target);
        if (sampler.isEmpty()) {
            log.debug("No sampler for {} ({} / {})", target.chainId(), target.protocolFamily(), target.protocol());
            return inspectPage(target).orElseGet(() -> MeasurementResult.skipped(target, UNSUPPORTED_PROTOCOL_FAMILY));
        }
        String lastFailure = null;
        for (String endpoint : target.candidateEndpoints()) {
            if (Thread.currentThread().isInterrupted()) {
                return MeasurementResult.error(target, INTERRUPTED);
            }
            try {
                return sampler.get().sample(endpoint, target);
            } catch (FetchException | SampleException e) {
                lastFailure = e.getMessage();
                log.debug("{} failed at {}: {}", target.chainId(), endpoint, lastFailure);
            } catch (RuntimeException e) {
                lastFailure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("{} sampler error at {}: {}", target.chainId(), endpoint, e.toString());
            }
        }
        String detail = lastFailure != null ? lastFailure : "all_endpoints_failed";
        return inspectPage(target).orElseGet(() -> MeasurementResult.error(target, detail));
    }

    private Optional<MeasurementResult> inspectPage(ChainTarget target) {
        if (!pageInspectionSampler.supports(target) || Thread.currentThread().isInterrupted()) {
            return Optional.empty();
        }
        try {
            return Optional.of(pageInspectionSampler.inspect(target));
        } catch (FetchException | SampleException e) {
            log.debug("Page inspection failed for {}: {}", target.chainId(), e.getMessage());
            return Optional.empty();
        }
    }
}
