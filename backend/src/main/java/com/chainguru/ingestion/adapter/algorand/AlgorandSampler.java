package com.chainguru.ingestion.adapter.algorand;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.AbstractWindowSampler;
import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.ChainUnit;
import com.chainguru.ingestion.config.SamplingProperties;
import com.chainguru.ingestion.config.SamplingProperties.WindowSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Algorand rounds over the REST API. Reads both the algod block shape ({@code {"block":{"rnd","ts","txns","tc"}}})
 * and the indexer shape ({@code round}, {@code timestamp}, {@code transactions}, {@code txn-counter}); the
 * transaction counter is the exact lifetime total.
 */
@Component
public class AlgorandSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "algorand";

    private final SamplingProperties samplingProperties;

    public AlgorandSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.CUSTOM && PROTOCOL.equals(target.protocol());
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getAlgorand();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        JsonNode status = require(client.get(baseUrl(endpoint) + "/v2/status"), "status");
        return fetchUnit(endpoint, asLong(status.path("last-round"), "last-round"));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long round) {
        JsonNode root = require(client.get(baseUrl(endpoint) + "/v2/blocks/" + round), "block");
        JsonNode algod = root.path("block");
        if (algod.isObject()) {
            Long counter = algod.has("tc") ? asLong(algod.path("tc"), "tc") : null;
            // algod omits empty fields
            Double ts = algod.has("ts") ? (double) asLong(algod.path("ts"), "ts") : null;
            return new ChainUnit(round, ts, algod.path("txns").size(), counter);
        }
        Long counter = root.has("txn-counter") ? asLong(root.path("txn-counter"), "txn-counter") : null;
        return new ChainUnit(round, (double) asLong(root.path("timestamp"), "timestamp"),
                root.path("transactions").size(), counter);
    }
}
