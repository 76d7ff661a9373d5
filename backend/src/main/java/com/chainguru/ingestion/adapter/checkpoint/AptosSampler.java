package com.chainguru.ingestion.adapter.checkpoint;

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

/**
 * Aptos REST API. Ledger info gives the head block, its time (microseconds) and the ledger version, which is the
 * exact lifetime transaction counter. Only {@code user_transaction} entries count towards throughput.
 */
@Component
public class AptosSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "aptos";
    static final String USER_TRANSACTION = "user_transaction";

    private final SamplingProperties samplingProperties;

    public AptosSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.CHECKPOINT_LEDGER && PROTOCOL.equals(target.protocol());
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getAptos();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        JsonNode ledger = require(client.get(apiBase(endpoint)), "ledger_info");
        long height = asLong(ledger.path("block_height"), "block_height");
        double seconds = toSeconds(asLong(ledger.path("ledger_timestamp"), "ledger_timestamp"), ChronoUnit.MICROS);
        return new ChainUnit(height, seconds, -1, asLong(ledger.path("ledger_version"), "ledger_version"));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        JsonNode block = require(client.get(blockUrl(endpoint, height, false)), "block");
        double seconds = toSeconds(asLong(block.path("block_timestamp"), "block_timestamp"), ChronoUnit.MICROS);
        return ChainUnit.of(height, seconds, -1);
    }

    @Override
    protected int countTransactions(String endpoint, long height) {
        JsonNode block = require(client.get(blockUrl(endpoint, height, true)), "block");
        int count = 0;
        for (JsonNode tx : block.path("transactions")) {
            if (USER_TRANSACTION.equals(tx.path("type").asText())) {
                count++;
            }
        }
        return count;
    }

    private static String blockUrl(String endpoint, long height, boolean withTransactions) {
        return apiBase(endpoint) + "/blocks/by_height/" + height + "?with_transactions=" + withTransactions;
    }

    /** Endpoints are configured with or without the /v1 suffix. */
    static String apiBase(String endpoint) {
        String base = baseUrl(endpoint);
        return base.endsWith("/v1") ? base : base + "/v1";
    }
}
