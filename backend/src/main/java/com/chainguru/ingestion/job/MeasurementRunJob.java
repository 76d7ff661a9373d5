package com.chainguru.ingestion.job;

import com.chainguru.config.SchedulerConfig;
import com.chainguru.domain.ChainTarget;
import com.chainguru.ingestion.config.MeasurementProperties;
import com.chainguru.ingestion.registry.TargetRegistryLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic measurement of every registry target. Overlapping triggers are refused while a run is active.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeasurementRunJob {

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final TargetRegistryLoader registryLoader;
    private final MeasurementDispatcher dispatcher;
    private final MeasurementProperties properties;
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    private final TaskScheduler schedulerPool;

    @Scheduled(
            fixedDelayString = "${chainguru.measurement.poll-interval-ms:21600000}",
            initialDelayString = "${chainguru.measurement.poll-interval-ms:21600000}")
    public void runScheduled() {
        runOnce();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isRunOnStartup()) {
            schedulerPool.schedule(this::runOnceLoggingFailure, Instant.now());
        }
    }

    /**
     * Loads targets and measures them all. Empty when another run is in progress.
     *
     * @throws com.chainguru.ingestion.registry.RegistryUnavailableException if targets cannot be loaded
     * @throws com.chainguru.ingestion.store.StoreUnavailableException       if results cannot be stored
     */
    public Optional<MeasurementRunProgress> runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Measurement run already in progress; trigger ignored");
            return Optional.empty();
        }
        try {
            List<ChainTarget> targets = registryLoader.loadTargets();
            log.info("Measurement run started: {} targets, concurrency {}", targets.size(), properties.getConcurrency());
            long startedAt = System.currentTimeMillis();
            MeasurementRunProgress progress = dispatcher.run(targets, properties.getConcurrency(),
                    Duration.ofMillis(properties.getPerTargetTimeoutMs()));
            log.info("Measurement run finished in {} s: {}", (System.currentTimeMillis() - startedAt) / 1000, progress);
            return Optional.of(progress);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runOnceLoggingFailure() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Startup measurement run aborted: {}", e.getMessage(), e);
        }
    }
}
