package com.chainguru.ingestion.adapter.utxo;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.FakeChainDataClient;
import com.chainguru.ingestion.config.SamplingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.LongUnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;

class BitcoinSamplerTest {

    private static final String ENDPOINT = "https://btc.test";
    private static final long TIP = 800_000;

    private FakeChainDataClient client;
    private BitcoinSampler sampler;
    private ChainTarget target;

    @BeforeEach
    void setUp() {
        client = new FakeChainDataClient();
        sampler = new BitcoinSampler(client, new SamplingProperties());
        target = new ChainTarget("bitcoin", "Bitcoin", ProtocolFamily.UTXO_FORK, null, List.of(ENDPOINT), null);
    }

    private void chain(LongUnaryOperator blockTime) {
        client.onCall("getblockchaininfo", params -> "{\"blocks\":" + TIP + "}")
                .onCall("getblockhash", params -> "\"h" + ((List<?>) params).get(0) + "\"")
                .onCall("getblock", params -> {
                    long height = Long.parseLong(((String) ((List<?>) params).get(0)).substring(1));
                    return """
                            {"hash":"h%d","time":%d,"tx":%s}
                            """.formatted(height, blockTime.applyAsLong(height),
                            FakeChainDataClient.items(3000, "t"));
                });
    }

    @Test
    void supports_utxoFork_returnsTrue() {
        assertThat(sampler.supports(target)).isTrue();
        assertThat(sampler.supports(new ChainTarget("doge", "Doge", ProtocolFamily.UTXO_FORK, "bitcoin", List.of(), null)))
                .isTrue();
    }

    @Test
    void sample_tenMinuteBlocks_tpsFromObservedWindow() {
        chain(h -> 1_700_000_000L + h * 600);

        MeasurementResult result = sampler.sample(ENDPOINT, target);

        // 3000 tx every 600 s
        assertThat(result.tpsEstimate()).isEqualTo(5.0);
        assertThat(result.totalTxEstimate()).isEqualTo(2.4e9);
    }

    @Test
    @DisplayName("miner timestamps collapsing the window fall back to the nominal block time")
    void sample_nonMonotonicTimestamps_usesAssumedBlockTime() {
        chain(h -> 1_700_000_000L);

        MeasurementResult result = sampler.sample(ENDPOINT, target);

        assertThat(result.tpsEstimate()).isEqualTo(5.0);
    }

    @Test
    void sample_readsBlocksByHash() {
        chain(h -> 1_700_000_000L + h * 600);

        sampler.sample(ENDPOINT, target);

        assertThat(client.calls()).contains("getblockhash [799997]", "getblock [h799997, 1]");
    }
}
