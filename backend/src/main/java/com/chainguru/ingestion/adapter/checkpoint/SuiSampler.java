package com.chainguru.ingestion.adapter.checkpoint;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.adapter.AbstractWindowSampler;
import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.ChainUnit;
import com.chainguru.ingestion.adapter.SampleException;
import com.chainguru.ingestion.config.SamplingProperties;
import com.chainguru.ingestion.config.SamplingProperties.WindowSettings;
import com.chainguru.ingestion.fetch.FetchException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Sui checkpoints over JSON-RPC. Checkpoint timestamps are milliseconds; the lifetime total comes from
 * sui_getTotalTransactionBlocks, falling back to the checkpoint's networkTotalTransactions.
 */
@Slf4j
@Component
public class SuiSampler extends AbstractWindowSampler {

    public static final String PROTOCOL = "sui";

    private final SamplingProperties samplingProperties;

    public SuiSampler(ChainDataClient client, SamplingProperties samplingProperties) {
        super(client);
        this.samplingProperties = samplingProperties;
    }

    @Override
    public boolean supports(ChainTarget target) {
        return target.protocolFamily() == ProtocolFamily.CHECKPOINT_LEDGER && target.protocolIsOrDefault(PROTOCOL);
    }

    @Override
    protected WindowSettings settings() {
        return samplingProperties.getSui();
    }

    @Override
    protected ChainUnit fetchHead(String endpoint) {
        JsonNode seq = client.call(endpoint, "sui_getLatestCheckpointSequenceNumber", List.of());
        return fetchUnit(endpoint, asLong(seq, "checkpoint_sequence"));
    }

    @Override
    protected ChainUnit fetchUnit(String endpoint, long height) {
        JsonNode checkpoint = require(client.call(endpoint, "sui_getCheckpoint", List.of(Long.toString(height))),
                "checkpoint");
        double seconds = toSeconds(asLong(checkpoint.path("timestampMs"), "timestampMs"), ChronoUnit.MILLIS);
        JsonNode txs = checkpoint.path("transactions");
        JsonNode running = checkpoint.path("networkTotalTransactions");
        Long runningTotal = running.isMissingNode() || running.isNull() ? null : asLong(running, "networkTotalTransactions");
        return new ChainUnit(height, seconds, txs.isArray() ? txs.size() : 0, runningTotal);
    }

    @Override
    protected Double exactTotal(String endpoint, ChainUnit head) {
        try {
            return (double) asLong(client.call(endpoint, "sui_getTotalTransactionBlocks", List.of()), "total");
        } catch (FetchException | SampleException e) {
            log.debug("sui_getTotalTransactionBlocks failed at {}: {}", endpoint, e.getMessage());
            return super.exactTotal(endpoint, head);
        }
    }
}
