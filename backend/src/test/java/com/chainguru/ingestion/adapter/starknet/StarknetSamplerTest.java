package com.chainguru.ingestion.adapter.starknet;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.FakeChainDataClient;
import com.chainguru.ingestion.config.SamplingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StarknetSamplerTest {

    private static final String ENDPOINT = "https://rpc.starknet.test";
    private static final long HEAD = 700_000;

    private FakeChainDataClient client;
    private StarknetSampler sampler;
    private ChainTarget target;

    @BeforeEach
    void setUp() {
        client = new FakeChainDataClient();
        sampler = new StarknetSampler(client, new SamplingProperties());
        target = new ChainTarget("starknet", "Starknet", ProtocolFamily.CUSTOM, "starknet", List.of(ENDPOINT), null);
        // six-second blocks with 12 transaction hashes each
        client.onCall(StarknetSampler.GET_BLOCK, params -> {
            Object id = ((List<?>) params).get(0);
            long number = "latest".equals(id) ? HEAD : ((Number) ((Map<?, ?>) id).get("block_number")).longValue();
            return """
                    {"block_number":%d,"timestamp":%d,"status":"ACCEPTED_ON_L2","transactions":%s}
                    """.formatted(number, 1_700_000_000L + number * 6, FakeChainDataClient.items(12, "0xtx"));
        });
    }

    @Test
    void sample_averagesTransactionHashesPerBlock() {
        MeasurementResult result = sampler.sample(ENDPOINT, target);

        assertThat(result.tpsEstimate()).isEqualTo(2.0);
        assertThat(result.totalTxEstimate()).isEqualTo(8_400_000.0);
    }

    @Test
    void sample_headIsLatestAndReferenceIsAddressedByNumber() {
        sampler.sample(ENDPOINT, target);

        assertThat(client.calls()).contains(
                StarknetSampler.GET_BLOCK + " [latest]",
                StarknetSampler.GET_BLOCK + " [{block_number=699980}]");
    }

    @Test
    void supports_requiresStarknetHint() {
        assertThat(sampler.supports(target)).isTrue();
        assertThat(sampler.supports(new ChainTarget("near", "NEAR", ProtocolFamily.CUSTOM, "near", List.of(), null)))
                .isFalse();
    }
}
