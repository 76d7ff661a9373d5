package com.chainguru.ingestion.adapter.cosmos;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.AbstractWindowSampler;
import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.ChainUnit;
import com.chainguru.ingestion.adapter.SampleException;
import com.chainguru.ingestion.config.SamplingProperties;
import com.chainguru.ingestion.config.SamplingProperties.WindowSettings;
import com.chainguru.ingestion.fetch.FetchBlockedException;
import com.chainguru.ingestion.fetch.FetchException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cosmos SDK chains over the LCD/REST API. Uses the tendermint service paths and falls back to the legacy
 * {@code /blocks/*} routes; an endpoint that only answers the legacy routes is remembered for later calls.
 */
@Slf4j
@Component
public class CosmosSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "cosmos";

    static final String MODERN_PATH = "/cosmos/base/tendermint/v1beta1/blocks/";
    static final String LEGACY_PATH = "/blocks/";

    private final SamplingProperties samplingProperties;
    private final Map<String, Boolean> legacyEndpoints = new ConcurrentHashMap<>();

    public CosmosSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.COSMOS_LIKE && target.protocolIsOrDefault(PROTOCOL);
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getCosmos();
    }

    @Override
    protected long firstHeight() {
        return 1;
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        return getBlock(endpoint, "latest");
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        return getBlock(endpoint, Long.toString(height));
    }

    private ChainUnit getBlock(String endpoint, String id) {
        String base = baseUrl(endpoint);
        if (!legacyEndpoints.containsKey(base)) {
            try {
                return parseBlock(client.get(base + MODERN_PATH + id));
            } catch (FetchBlockedException e) {
                throw e;
            } catch (FetchException | SampleException e) {
                log.debug("Tendermint service path failed at {}, trying legacy route: {}", base, e.getMessage());
            }
        }
        ChainUnit unit = parseBlock(client.get(base + LEGACY_PATH + id));
        legacyEndpoints.put(base, Boolean.TRUE);
        return unit;
    }

    private static ChainUnit parseBlock(JsonNode root) {
        JsonNode block = require(root.path("block"), "block");
        JsonNode header = block.path("header");
        long height = asLong(header.path("height"), "height");
        String time = header.path("time").asText(null);
        if (time == null) {
            throw new SampleException("missing_time");
        }
        double seconds;
        try {
            OffsetDateTime parsed = OffsetDateTime.parse(time);
            seconds = parsed.toEpochSecond() + parsed.getNano() / 1_000_000_000.0;
        } catch (DateTimeParseException e) {
            throw new SampleException("invalid_time", e);
        }
        JsonNode txs = block.path("data").path("txs");
        return ChainUnit.of(height, seconds, txs.isArray() ? txs.size() : 0);
    }
}
