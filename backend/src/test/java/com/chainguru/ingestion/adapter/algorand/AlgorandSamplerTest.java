package com.chainguru.ingestion.adapter.algorand;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.FakeChainDataClient;
import com.chainguru.ingestion.config.SamplingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlgorandSamplerTest {

    private static final String ENDPOINT = "https://algod.test";
    private static final long LAST_ROUND = 3000;
    private static final long GENESIS = 1_700_000_000L;

    private FakeChainDataClient client;
    private AlgorandSampler sampler;
    private ChainTarget target;

    @BeforeEach
    void setUp() {
        client = new FakeChainDataClient();
        sampler = new AlgorandSampler(client, new SamplingProperties());
        target = new ChainTarget("algorand", "Algorand", ProtocolFamily.CUSTOM, "algorand", List.of(ENDPOINT), null);
        client.onGet(ENDPOINT + "/v2/status", rest -> "{\"last-round\":" + LAST_ROUND + "}");
    }

    @Test
    @DisplayName("algod block shape: ts, txns and the tc counter")
    void sample_algodShape() {
        client.onGet(ENDPOINT + "/v2/blocks/", rest -> {
            long round = Long.parseLong(rest);
            return """
                    {"block":{"rnd":%d,"ts":%d,"txns":%s,"tc":%d}}
                    """.formatted(round, GENESIS + round * 3, FakeChainDataClient.items(6, "t"), 18_000);
        });

        MeasurementResult result = sampler.sample(ENDPOINT, target);

        // 6 transactions per 3 s round
        assertThat(result.tpsEstimate()).isEqualTo(2.0);
        assertThat(result.totalTxEstimate()).isEqualTo(18_000.0);
    }

    @Test
    @DisplayName("indexer block shape: timestamp, transactions and txn-counter")
    void sample_indexerShape() {
        client.onGet(ENDPOINT + "/v2/blocks/", rest -> {
            long round = Long.parseLong(rest);
            return """
                    {"round":%d,"timestamp":%d,"transactions":%s,"txn-counter":%d}
                    """.formatted(round, GENESIS + round * 3, FakeChainDataClient.items(6, "t"), 18_000);
        });

        MeasurementResult result = sampler.sample(ENDPOINT, target);

        assertThat(result.tpsEstimate()).isEqualTo(2.0);
        assertThat(result.totalTxEstimate()).isEqualTo(18_000.0);
    }

    @Test
    void sample_noCounter_extrapolatesTotal() {
        client.onGet(ENDPOINT + "/v2/blocks/", rest -> {
            long round = Long.parseLong(rest);
            return """
                    {"block":{"rnd":%d,"ts":%d,"txns":%s}}
                    """.formatted(round, GENESIS + round * 3, FakeChainDataClient.items(6, "t"));
        });

        MeasurementResult result = sampler.sample(ENDPOINT, target);

        assertThat(result.totalTxEstimate()).isEqualTo(18_000.0);
    }
}
