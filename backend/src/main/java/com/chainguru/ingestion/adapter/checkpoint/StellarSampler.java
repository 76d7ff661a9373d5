package com.chainguru.ingestion.adapter.checkpoint;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.AbstractWindowSampler;
import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.ChainUnit;
import com.chainguru.ingestion.adapter.SampleException;
import com.chainguru.ingestion.config.SamplingProperties;
import com.chainguru.ingestion.config.SamplingProperties.WindowSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Stellar ledgers over Horizon REST. The newest ledger comes from {@code /ledgers?order=desc&limit=1}, older ones
 * from {@code /ledgers/{sequence}}. Ledger close times are ISO-8601; both successful and failed transactions count.
 */
@Component
public class StellarSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "stellar";

    private final SamplingProperties samplingProperties;

    public StellarSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.CHECKPOINT_LEDGER && PROTOCOL.equals(target.protocol());
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getStellar();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        JsonNode page = client.get(baseUrl(endpoint) + "/ledgers?order=desc&limit=1");
        return toUnit(require(page.path("_embedded").path("records").path(0), "ledger"));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        ChainUnit unit = toUnit(require(client.get(baseUrl(endpoint) + "/ledgers/" + height), "ledger"));
        if (unit.height() != height) {
            throw new SampleException("ledger_mismatch");
        }
        return unit;
    }

    private static ChainUnit toUnit(JsonNode ledger) {
        long sequence = asLong(ledger.path("sequence"), "sequence");
        int txCount = (int) (asLong(ledger.path("successful_transaction_count"), "successful_transaction_count")
                + ledger.path("failed_transaction_count").asLong(0));
        return ChainUnit.of(sequence, closedAtSeconds(ledger.path("closed_at")), txCount);
    }

    static double closedAtSeconds(JsonNode closedAt) {
        if (closedAt.isMissingNode() || closedAt.isNull()) {
            throw new SampleException("missing_closed_at");
        }
        try {
            return Instant.parse(closedAt.asText().trim()).getEpochSecond();
        } catch (DateTimeParseException e) {
            throw new SampleException("invalid_closed_at", e);
        }
    }
}
