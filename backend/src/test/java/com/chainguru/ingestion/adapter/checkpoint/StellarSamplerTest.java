package com.chainguru.ingestion.adapter.checkpoint;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.FakeChainDataClient;
import com.chainguru.ingestion.adapter.SampleException;
import com.chainguru.ingestion.config.SamplingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.function.LongPredicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StellarSamplerTest {

    private static final String ENDPOINT = "https://horizon.stellar.test";
    private static final long HEAD = 10_000;

    private FakeChainDataClient client;
    private StellarSampler sampler;
    private ChainTarget target;

    @BeforeEach
    void setUp() {
        client = new FakeChainDataClient();
        sampler = new StellarSampler(client, new SamplingProperties());
        target = new ChainTarget("stellar", "Stellar", ProtocolFamily.CHECKPOINT_LEDGER, "stellar",
                List.of(ENDPOINT), null);
    }

    /** Five-second ledgers with 8 successful and 2 failed transactions each. */
    private static String ledger(long sequence) {
        return """
                {"sequence":%d,"closed_at":"%s","successful_transaction_count":8,"failed_transaction_count":2,
                 "operation_count":40}
                """.formatted(sequence, Instant.ofEpochSecond(1_700_000_000L + sequence * 5));
    }

    private void ledgers(LongPredicate available) {
        client.onGet(ENDPOINT + "/ledgers?order=desc", rest -> "{\"_embedded\":{\"records\":[" + ledger(HEAD) + "]}}");
        client.onGet(ENDPOINT + "/ledgers/", rest -> {
            long sequence = Long.parseLong(rest);
            return available.test(sequence) ? ledger(sequence) : null;
        });
    }

    @Test
    void sample_countsSuccessfulAndFailedTransactions() {
        ledgers(s -> true);

        MeasurementResult result = sampler.sample(ENDPOINT + "/", target);

        // 10 tx per 5 s ledger
        assertThat(result.tpsEstimate()).isEqualTo(2.0);
        assertThat(result.totalTxEstimate()).isEqualTo(100_000.0);
        assertThat(client.calls()).contains("GET " + ENDPOINT + "/ledgers/9900");
    }

    @Test
    void sample_oldLedgersMissing_fallsBackToShorterLookback() {
        ledgers(s -> s >= 9950);

        MeasurementResult result = sampler.sample(ENDPOINT, target);

        assertThat(result.tpsEstimate()).isEqualTo(2.0);
        assertThat(client.calls()).contains("GET " + ENDPOINT + "/ledgers/9990");
    }

    @Test
    void sample_badCloseTime_failsWithFieldName() {
        client.onGet(ENDPOINT + "/ledgers?order=desc", rest -> """
                {"_embedded":{"records":[{"sequence":5,"closed_at":"yesterday","successful_transaction_count":1}]}}
                """);

        assertThatThrownBy(() -> sampler.sample(ENDPOINT, target))
                .isInstanceOf(SampleException.class)
                .hasMessage("invalid_closed_at");
    }

    @Test
    void sample_emptyLedgerPage_missingLedger() {
        client.onGet(ENDPOINT + "/ledgers?order=desc", rest -> "{\"_embedded\":{\"records\":[]}}");

        assertThatThrownBy(() -> sampler.sample(ENDPOINT, target))
                .isInstanceOf(SampleException.class)
                .hasMessage("missing_ledger");
    }

    @Test
    void supports_requiresStellarHint() {
        assertThat(sampler.supports(target)).isTrue();
        assertThat(sampler.supports(new ChainTarget("sui", "Sui", ProtocolFamily.CHECKPOINT_LEDGER, null,
                List.of(), null))).isFalse();
    }
}
