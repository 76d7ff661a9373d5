package com.chainguru.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Read access to chain_metrics. Writes go through ChainMetricsStore's sparse upsert.
 */
public interface ChainMetricsRepository extends MongoRepository<ChainMetrics, String> {

    List<ChainMetrics> findByStatus(MeasurementStatus status);
}
