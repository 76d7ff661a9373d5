package com.chainguru.ingestion.adapter;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.domain.MeasurementSource;
import com.chainguru.domain.MeasurementStatus;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.page.PageInspectionSampler;
import com.chainguru.ingestion.fetch.FetchBlockedException;
import com.chainguru.ingestion.fetch.FetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EndpointFailoverSamplerTest {

    private ScriptedSampler accountSampler;
    private PageInspectionSampler pageInspection;
    private EndpointFailoverSampler failover;

    @BeforeEach
    void setUp() {
        accountSampler = new ScriptedSampler(ProtocolFamily.ACCOUNT_MODEL);
        pageInspection = mock(PageInspectionSampler.class);
        failover = new EndpointFailoverSampler(List.of(accountSampler), pageInspection);
    }

    private static ChainTarget target(ProtocolFamily family, List<String> endpoints, String explorerUrl) {
        return new ChainTarget("1", "Ethereum", family, null, endpoints, explorerUrl);
    }

    @Test
    @DisplayName("all candidates failing yields ERROR with the last reason and no endpoint")
    void measure_allEndpointsFail_errorWithLastReason() {
        accountSampler.failWith("https://a.test", new FetchException("timeout"));
        accountSampler.failWith("https://b.test", new FetchException("http_503"));
        accountSampler.failWith("https://c.test", new SampleException(SampleException.NO_START_BLOCK));

        MeasurementResult result = failover.measure(
                target(ProtocolFamily.ACCOUNT_MODEL, List.of("https://a.test", "https://b.test", "https://c.test"), null));

        assertThat(result.status()).isEqualTo(MeasurementStatus.ERROR);
        assertThat(result.errorDetail()).isEqualTo(SampleException.NO_START_BLOCK);
        assertThat(result.endpointUsed()).isNull();
        assertThat(accountSampler.attempts).containsExactly("https://a.test", "https://b.test", "https://c.test");
    }

    @Test
    void measure_blockedFirstCandidate_triesNextAndRecordsIt() {
        accountSampler.failWith("http://127.0.0.1:8545", new FetchBlockedException("http://127.0.0.1:8545",
                "private_ip_blocked"));

        MeasurementResult result = failover.measure(
                target(ProtocolFamily.ACCOUNT_MODEL, List.of("http://127.0.0.1:8545", "https://rpc.test"), null));

        assertThat(result.status()).isEqualTo(MeasurementStatus.SUCCESS);
        assertThat(result.endpointUsed()).isEqualTo("https://rpc.test");
    }

    @Test
    void measure_firstSuccessStopsFailover() {
        MeasurementResult result = failover.measure(
                target(ProtocolFamily.ACCOUNT_MODEL, List.of("https://a.test", "https://b.test"), null));

        assertThat(result.endpointUsed()).isEqualTo("https://a.test");
        assertThat(accountSampler.attempts).containsExactly("https://a.test");
        verify(pageInspection, never()).inspect(any());
    }

    @Test
    void measure_unexpectedSamplerBug_isContainedAsError() {
        accountSampler.failWith("https://a.test", new IllegalStateException("boom"));

        MeasurementResult result = failover.measure(target(ProtocolFamily.ACCOUNT_MODEL, List.of("https://a.test"), null));

        assertThat(result.status()).isEqualTo(MeasurementStatus.ERROR);
        assertThat(result.errorDetail()).isEqualTo("boom");
    }

    @Test
    void measure_endpointsFailWithExplorer_fallsBackToPageInspection() {
        ChainTarget target = target(ProtocolFamily.ACCOUNT_MODEL, List.of("https://a.test"), "https://explorer.test");
        accountSampler.failWith("https://a.test", new FetchException("http_429"));
        MeasurementResult scraped = MeasurementResult.pageInspection(target, 12.0, 1_000.0);
        when(pageInspection.supports(target)).thenReturn(true);
        when(pageInspection.inspect(target)).thenReturn(scraped);

        MeasurementResult result = failover.measure(target);

        assertThat(result.source()).isEqualTo(MeasurementSource.PAGE_INSPECTION);
        assertThat(result.tpsEstimate()).isEqualTo(12.0);
    }

    @Test
    void measure_pageInspectionAlsoFails_keepsEndpointReason() {
        ChainTarget target = target(ProtocolFamily.ACCOUNT_MODEL, List.of("https://a.test"), "https://explorer.test");
        accountSampler.failWith("https://a.test", new FetchException("http_429"));
        when(pageInspection.supports(target)).thenReturn(true);
        when(pageInspection.inspect(target)).thenThrow(new SampleException(PageInspectionSampler.NO_MATCHES));

        MeasurementResult result = failover.measure(target);

        assertThat(result.status()).isEqualTo(MeasurementStatus.ERROR);
        assertThat(result.errorDetail()).isEqualTo("http_429");
    }

    @Test
    void measure_noEndpoints_skippedWithoutSampling() {
        MeasurementResult result = failover.measure(target(ProtocolFamily.ACCOUNT_MODEL, List.of(), null));

        assertThat(result.status()).isEqualTo(MeasurementStatus.SKIPPED);
        assertThat(result.errorDetail()).isEqualTo(EndpointFailoverSampler.NO_CANDIDATE_ENDPOINT);
        assertThat(accountSampler.attempts).isEmpty();
    }

    @Test
    void measure_unsupportedFamily_skipped() {
        MeasurementResult result = failover.measure(target(ProtocolFamily.SUBSTRATE, List.of("https://a.test"), null));

        assertThat(result.status()).isEqualTo(MeasurementStatus.SKIPPED);
        assertThat(result.errorDetail()).isEqualTo(EndpointFailoverSampler.UNSUPPORTED_PROTOCOL_FAMILY);
    }

    @Test
    void measure_unsupportedFamilyWithExplorer_usesPageInspection() {
        ChainTarget target = target(ProtocolFamily.SUBSTRATE, List.of("https://a.test"), "https://explorer.test");
        when(pageInspection.supports(target)).thenReturn(true);
        when(pageInspection.inspect(target)).thenReturn(MeasurementResult.pageInspection(target, 3.0, null));

        MeasurementResult result = failover.measure(target);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.source()).isEqualTo(MeasurementSource.PAGE_INSPECTION);
    }

    /** Succeeds on every endpoint unless a failure was scripted for it; records attempts in order. */
    private static final class ScriptedSampler implements SamplerAdapter {

        private final ProtocolFamily family;
        private final Map<String, Supplier<RuntimeException>> failures = new HashMap<>();
        private final List<String> attempts = new ArrayList<>();

        ScriptedSampler(ProtocolFamily family) {
            this.family = family;
        }

        void failWith(String endpoint, RuntimeException failure) {
            failures.put(endpoint, () -> failure);
        }

        @Override
        public boolean supports(ChainTarget target) {
            return target.protocolFamily() == family;
        }

        @Override
        public MeasurementResult sample(String endpoint, ChainTarget target) {
            attempts.add(endpoint);
            Supplier<RuntimeException> failure = failures.get(endpoint);
            if (failure != null) {
                throw failure.get();
            }
            return MeasurementResult.success(target, endpoint, 10.0, 100.0);
        }
    }
}
