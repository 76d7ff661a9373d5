package com.chainguru.ingestion.adapter.evm;

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

/**
 * Account-model chains via eth_getBlockByNumber (hashes only). Timestamps are hex seconds; the window is refined
 * towards ~10 minutes.
 */
@Component
public class EvmSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "evm";

    private final SamplingProperties samplingProperties;

    public EvmSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.ACCOUNT_MODEL && target.protocolIsOrDefault(PROTOCOL);
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getEvm();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        return getBlock(endpoint, "latest");
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        return getBlock(endpoint, "0x" + Long.toHexString(height));
    }

    private ChainUnit getBlock(String endpoint, String blockTag) {
        JsonNode block = require(client.call(endpoint, "eth_getBlockByNumber", List.of(blockTag, false)), "block");
        long number = asLong(block.path("number"), "number");
        long timestamp = asLong(block.path("timestamp"), "timestamp");
        JsonNode txs = block.path("transactions");
        return ChainUnit.of(number, (double) timestamp, txs.isArray() ? txs.size() : 0);
    }
}
