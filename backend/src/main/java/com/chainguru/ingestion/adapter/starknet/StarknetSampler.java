package com.chainguru.ingestion.adapter.starknet;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.AbstractWindowSampler;
import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.ChainUnit;
import com.chainguru.ingestion.config.SamplingProperties;
import com.chainguru.ingestion.config.SamplingProperties.WindowSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Starknet JSON-RPC. Blocks are read with {@code starknet_getBlockWithTxHashes}, so only hashes travel; timestamps
 * are seconds.
 */
@Component
public class StarknetSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "starknet";
    static final String GET_BLOCK = "starknet_getBlockWithTxHashes";

    private final SamplingProperties samplingProperties;

    public StarknetSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.CUSTOM && PROTOCOL.equals(target.protocol());
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getStarknet();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        return toUnit(require(client.call(endpoint, GET_BLOCK, List.of("latest")), "block"));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        return toUnit(require(client.call(endpoint, GET_BLOCK, List.of(Map.of("block_number", height))), "block"));
    }

    private static ChainUnit toUnit(JsonNode block) {
        long number = asLong(block.path("block_number"), "block_number");
        long timestamp = asLong(block.path("timestamp"), "timestamp");
        JsonNode txs = block.path("transactions");
        return ChainUnit.of(number, (double) timestamp, txs.isArray() ? txs.size() : 0);
    }
}
