package com.chainguru.ingestion.adapter.utxo;

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
 * Bitcoin-style nodes: getblockchaininfo for the tip, getblockhash + getblock (verbosity 1, txids only) per block.
 * Block times are miner-set and can even go backwards over a few blocks, so short windows use the nominal block time.
 */
@Component
public class BitcoinSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "bitcoin";

    private final SamplingProperties samplingProperties;

    public BitcoinSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.UTXO_FORK && target.protocolIsOrDefault(PROTOCOL);
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getBitcoin();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        JsonNode info = require(client.call(endpoint, "getblockchaininfo", List.of()), "blockchaininfo");
        return fetchUnit(endpoint, asLong(info.path("blocks"), "blocks"));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        JsonNode hash = require(client.call(endpoint, "getblockhash", List.of(height)), "blockhash");
        JsonNode block = require(client.call(endpoint, "getblock", List.of(hash.asText(), 1)), "block");
        JsonNode txs = block.path("tx");
        return ChainUnit.of(height, (double) asLong(block.path("time"), "time"), txs.isArray() ? txs.size() : 0);
    }
}
