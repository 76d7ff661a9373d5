package com.chainguru.ingestion.store;

import com.chainguru.domain.ChainMetrics;
import com.chainguru.domain.MeasurementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers measurement results and writes them to chain_metrics as sparse upserts. Only measurement fields are set;
 * fields owned by other writers (is_dead, explorer_url, x_handle) are never touched. Buffered results for the same
 * chain collapse to the latest one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChainMetricsStore {

    private final MongoTemplate mongoTemplate;

    private final Object bufferLock = new Object();
    private final Object commitLock = new Object();
    private Map<String, MeasurementResult> buffer = new LinkedHashMap<>();

    /**
     * Store-open check at run start.
     *
     * @throws StoreUnavailableException when the database does not answer a ping
     */
    public void open() {
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("chain_metrics store unavailable: " + e.getMessage(), e);
        }
    }

    public void upsert(MeasurementResult result) {
        synchronized (bufferLock) {
            buffer.put(result.chainId(), result);
        }
    }

    public int pendingCount() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    /**
     * Flushes buffered results in one unordered bulk write. Returns the number of documents written.
     *
     * @throws StoreUnavailableException when the bulk write fails
     */
    public int commit() {
        synchronized (commitLock) {
            List<MeasurementResult> pending;
            synchronized (bufferLock) {
                if (buffer.isEmpty()) {
                    return 0;
                }
                pending = new ArrayList<>(buffer.values());
                buffer = new LinkedHashMap<>();
            }
            try {
                BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ChainMetrics.class);
                for (MeasurementResult result : pending) {
                    ops.upsert(Query.query(Criteria.where("_id").is(result.chainId())), toUpdate(result));
                }
                ops.execute();
            } catch (DataAccessException e) {
                throw new StoreUnavailableException("chain_metrics commit failed for " + pending.size()
                        + " results: " + e.getMessage(), e);
            }
            log.debug("Committed {} chain_metrics upserts", pending.size());
            return pending.size();
        }
    }

    static Update toUpdate(MeasurementResult result) {
        Update update = new Update()
                .set(ChainMetrics.TPS_10MIN, result.tpsEstimate())
                .set(ChainMetrics.TOTAL_TX_COUNT, result.totalTxEstimate())
                .set(ChainMetrics.STATUS, result.status().wireValue())
                .set(ChainMetrics.ERROR_MESSAGE, result.errorDetail())
                .set(ChainMetrics.LAST_UPDATED_AT, result.observedAt())
                .set(ChainMetrics.HEALTH_STATUS, result.healthLabel())
                .set(ChainMetrics.MEASUREMENT_SOURCE, result.source());
        if (result.endpointUsed() != null) {
            update.set(ChainMetrics.RPC_URL, result.endpointUsed());
        }
        if (result.chainName() != null) {
            update.set(ChainMetrics.CHAIN_NAME, result.chainName());
        }
        return update;
    }
}
