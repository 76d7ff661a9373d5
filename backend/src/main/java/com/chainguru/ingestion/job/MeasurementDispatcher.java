package com.chainguru.ingestion.job;

import com.chainguru.config.AsyncConfig;
import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.ingestion.adapter.EndpointFailoverSampler;
import com.chainguru.ingestion.config.MeasurementProperties;
import com.chainguru.ingestion.store.ChainMetricsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one measurement task per target with at most {@code concurrencyLimit} in flight. The coordinator loop runs on
 * the caller thread: it refills free slots, takes results in completion order, hands them to the store and commits
 * every {@code commitEvery} results. The timeout clock of a task starts when a worker picks it up, not when it is
 * queued. A task that exceeds its timeout is cancelled (worker interrupted), recorded as "timeout" and its slot freed
 * at once. If the coordinator itself is interrupted, every outstanding task is cancelled before the final commit.
 * <p>
 * Per-target failures never abort the run; only store failures do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeasurementDispatcher {

    public static final String TIMEOUT = "timeout";

    private final EndpointFailoverSampler failoverSampler;
    private final ChainMetricsStore store;
    private final MeasurementProperties properties;
    @Qualifier(AsyncConfig.MEASUREMENT_EXECUTOR)
    private final Executor measurementExecutor;

    public MeasurementRunProgress run(List<ChainTarget> targets, int concurrencyLimit, Duration perTargetTimeout) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        }
        if (perTargetTimeout == null || perTargetTimeout.isNegative() || perTargetTimeout.isZero()) {
            throw new IllegalArgumentException("perTargetTimeout must be positive");
        }
        List<ChainTarget> unique = dropDuplicates(targets);
        MeasurementRunProgress progress = new MeasurementRunProgress(unique.size());
        store.open();

        int commitEvery = Math.max(1, properties.getCommitEvery());
        int logEvery = Math.max(1, properties.getProgressLogEvery());
        BlockingQueue<MeasurementResult> completed = new LinkedBlockingQueue<>();
        Iterator<ChainTarget> pending = unique.iterator();
        List<FutureTask<Void>> submitted = new ArrayList<>();
        int inFlight = 0;
        int sinceCommit = 0;
        try {
            while (pending.hasNext() || inFlight > 0) {
                while (inFlight < concurrencyLimit && pending.hasNext()) {
                    ChainTarget target = pending.next();
                    if (!target.hasCandidateEndpoints()) {
                        completed.add(MeasurementResult.skipped(target, EndpointFailoverSampler.NO_CANDIDATE_ENDPOINT));
                    } else {
                        submitted.add(submit(target, perTargetTimeout, completed));
                    }
                    inFlight++;
                }
                MeasurementResult result = completed.take();
                inFlight--;
                store.upsert(result);
                progress.record(result);
                log.debug("{} -> {} {}", result.chainId(), result.status(),
                        result.isSuccess() ? result.tpsEstimate() : result.errorDetail());
                if (++sinceCommit >= commitEvery) {
                    store.commit();
                    sinceCommit = 0;
                }
                if (progress.completed() % logEvery == 0) {
                    log.info("Measurement progress: {}", progress);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            int cancelled = cancelOutstanding(submitted);
            log.warn("Measurement run interrupted at {}; cancelled {} outstanding tasks, committing partial results",
                    progress, cancelled);
        }
        store.commit();
        return progress;
    }

    private FutureTask<Void> submit(ChainTarget target, Duration timeout, BlockingQueue<MeasurementResult> completed) {
        CompletableFuture<MeasurementResult> promise = new CompletableFuture<>();
        FutureTask<Void> task = new FutureTask<>(() -> {
            promise.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                promise.complete(failoverSampler.measure(target));
            } catch (RuntimeException e) {
                promise.completeExceptionally(e);
            }
        }, null);
        promise.exceptionally(error -> {
                    task.cancel(true);
                    return failure(target, error);
                })
                .thenAccept(completed::add);
        try {
            measurementExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            promise.completeExceptionally(e);
        }
        return task;
    }

    private static int cancelOutstanding(List<FutureTask<Void>> submitted) {
        int cancelled = 0;
        for (FutureTask<Void> task : submitted) {
            if (task.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private static MeasurementResult failure(ChainTarget target, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.debug("{} timed out", target.chainId());
            return MeasurementResult.error(target, TIMEOUT);
        }
        log.warn("{} measurement failed: {}", target.chainId(), cause.toString());
        return MeasurementResult.error(target, cause.getMessage() != null ? cause.getMessage()
                : cause.getClass().getSimpleName());
    }

    private static List<ChainTarget> dropDuplicates(List<ChainTarget> targets) {
        Map<String, ChainTarget> byId = new LinkedHashMap<>();
        for (ChainTarget target : targets) {
            if (byId.putIfAbsent(target.chainId(), target) != null) {
                log.warn("Duplicate chainId {} in run; keeping first occurrence", target.chainId());
            }
        }
        return new ArrayList<>(byId.values());
    }
}
