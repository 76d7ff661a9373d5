package com.chainguru.ingestion.adapter.substrate;

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
 * Substrate chains (Polkadot and parachains). Headers carry no timestamp without decoding the timestamp extrinsic,
 * so the window uses the configured block time. Every extrinsic counts as a transaction, inherents included.
 */
@Component
public class SubstrateSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "substrate";

    private final SamplingProperties samplingProperties;

    public SubstrateSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.SUBSTRATE && target.protocolIsOrDefault(PROTOCOL);
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getSubstrate();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        JsonNode header = require(client.call(endpoint, "chain_getHeader", List.of()), "header");
        return ChainUnit.of(asLong(header.path("number"), "number"), null, -1);
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        JsonNode hash = require(client.call(endpoint, "chain_getBlockHash", List.of(height)), "block_hash");
        JsonNode signed = require(client.call(endpoint, "chain_getBlock", List.of(hash.asText())), "block");
        JsonNode extrinsics = signed.path("block").path("extrinsics");
        return ChainUnit.of(height, null, extrinsics.isArray() ? extrinsics.size() : 0);
    }
}
