package com.chainguru.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Durable, cumulative metrics per chain. One document per chainId.
 * The measurement engine writes the measurement fields only; isDead, explorerUrl and xHandle belong to other
 * collaborators and survive every upsert.
 */
@Document(collection = ChainMetrics.COLLECTION)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainMetrics {

    public static final String COLLECTION = "chain_metrics";

    public static final String CHAIN_NAME = "chain_name";
    public static final String RPC_URL = "rpc_url";
    public static final String TPS_10MIN = "tps_10min";
    public static final String LAST_UPDATED_AT = "last_updated_at";
    public static final String STATUS = "status";
    public static final String ERROR_MESSAGE = "error_message";
    public static final String TOTAL_TX_COUNT = "total_tx_count";
    public static final String HEALTH_STATUS = "health_status";
    public static final String MEASUREMENT_SOURCE = "measurement_source";
    public static final String IS_DEAD = "is_dead";
    public static final String EXPLORER_URL = "explorer_url";
    public static final String X_HANDLE = "x_handle";

    @Id
    @EqualsAndHashCode.Include
    private String chainId;
    @Field(CHAIN_NAME)
    private String chainName;
    @Field(RPC_URL)
    private String rpcUrl;
    @Field(TPS_10MIN)
    private Double tps10min;
    @Field(LAST_UPDATED_AT)
    private Instant lastUpdatedAt;
    @Field(STATUS)
    private MeasurementStatus status;
    @Field(ERROR_MESSAGE)
    private String errorMessage;
    @Field(TOTAL_TX_COUNT)
    private Double totalTxCount;
    @Field(HEALTH_STATUS)
    private String healthStatus;
    @Field(MEASUREMENT_SOURCE)
    private MeasurementSource measurementSource;
    /** Manually curated. */
    @Field(IS_DEAD)
    private Boolean dead;
    @Field(EXPLORER_URL)
    private String explorerUrl;
    @Field(X_HANDLE)
    private String xHandle;
}
