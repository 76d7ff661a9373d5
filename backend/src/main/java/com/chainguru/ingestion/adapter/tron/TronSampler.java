package com.chainguru.ingestion.adapter.tron;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.AbstractWindowSampler;
import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.ChainUnit;
import com.chainguru.ingestion.config.SamplingProperties;
import com.chainguru.ingestion.config.SamplingProperties.WindowSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Tron over the TronGrid wallet API (REST POSTs). Block timestamps are milliseconds. A block the node does not have
 * comes back as an empty object, which fails the header lookup.
 */
@Component
public class TronSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "tron";

    private final SamplingProperties samplingProperties;

    public TronSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.ACCOUNT_MODEL && PROTOCOL.equals(target.protocol());
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getTron();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        return toUnit(client.post(baseUrl(endpoint) + "/wallet/getnowblock", Map.of()));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        return toUnit(client.post(baseUrl(endpoint) + "/wallet/getblockbynum", Map.of("num", height)));
    }

    private static ChainUnit toUnit(JsonNode block) {
        JsonNode raw = require(block.path("block_header").path("raw_data"), "block_header");
        long number = asLong(raw.path("number"), "number");
        double seconds = toSeconds(asLong(raw.path("timestamp"), "timestamp"), ChronoUnit.MILLIS);
        // blocks without transactions omit the array
        JsonNode txs = block.path("transactions");
        return ChainUnit.of(number, seconds, txs.isArray() ? txs.size() : 0);
    }
}
