package com.chainguru.ingestion.adapter.near;

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
 * NEAR over JSON-RPC. Block headers carry nanosecond timestamps but no transaction count: each sampled block costs
 * one extra {@code chunk} call per chunk included at that height.
 */
@Component
public class NearSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "near";

    private final SamplingProperties samplingProperties;

    public NearSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.CUSTOM && PROTOCOL.equals(target.protocol());
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getNear();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        return toUnit(block(endpoint, Map.of("finality", "final")));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        return toUnit(block(endpoint, Map.of("block_id", height)));
    }

    @Override
    protected int countTransactions(String endpoint, long height) {
        JsonNode block = block(endpoint, Map.of("block_id", height));
        int count = 0;
        for (JsonNode chunk : block.path("chunks")) {
            if (chunk.path("height_included").asLong(-1) != height) {
                continue;
            }
            JsonNode body = require(client.call(endpoint, "chunk",
                    Map.of("chunk_id", chunk.path("chunk_hash").asText())), "chunk");
            count += body.path("transactions").size();
        }
        return count;
    }

    private JsonNode block(String endpoint, Map<String, Object> params) {
        return require(client.call(endpoint, "block", params), "block");
    }

    private static ChainUnit toUnit(JsonNode block) {
        JsonNode header = block.path("header");
        long height = asLong(header.path("height"), "height");
        JsonNode ts = header.has("timestamp_nanosec") ? header.path("timestamp_nanosec") : header.path("timestamp");
        return ChainUnit.of(height, toSeconds(asLong(ts, "timestamp"), ChronoUnit.NANOS), -1);
    }
}
