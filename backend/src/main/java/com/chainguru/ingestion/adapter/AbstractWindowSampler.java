package com.chainguru.ingestion.adapter;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.ingestion.config.SamplingProperties.WindowSettings;
import com.chainguru.ingestion.fetch.FetchException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Window estimator shared by block-like families. Picks a reference unit behind the head, optionally moves it so
 * the window spans a target duration, samples transaction counts between the two and extrapolates:
 * {@code tps = avgTxPerUnit * units / seconds}. Subclasses supply head and unit fetches in their native format
 * and normalise timestamps to seconds.
 */
@Slf4j
public abstract class AbstractWindowSampler implements SamplerAdapter {

    protected final ChainDataClient client;

    protected AbstractWindowSampler(ChainDataClient client) {
        this.client = client;
    }

    /** Lookbacks, sample size and window bounds for this family. Read on every sample so config changes apply. */
    protected abstract WindowSettings settings();

    protected abstract ChainUnit fetchHead(String endpoint);

    /**
     * Fetch the unit at {@code height}. Throws {@link FetchException} or {@link SampleException} when the endpoint
     * does not have it (pruned, not yet indexed).
     */
    protected abstract ChainUnit fetchUnit(String endpoint, long height);

    /** Transactions in the unit at {@code height}. Default fetches the unit and reads its count. */
    protected int countTransactions(String endpoint, long height) {
        ChainUnit unit = fetchUnit(endpoint, height);
        if (unit.txCount() < 0) {
            throw new SampleException("tx_count_unavailable");
        }
        return unit.txCount();
    }

    /** Exact lifetime transaction count, or null to extrapolate from the sample average. */
    protected Double exactTotal(String endpoint, ChainUnit head) {
        return head.runningTxCount() != null ? head.runningTxCount().doubleValue() : null;
    }

    /** Lowest valid height (genesis). */
    protected long firstHeight() {
        return 0;
    }

    @Override
    public MeasurementResult sample(String endpoint, ChainTarget target) {
        WindowSettings s = settings();
        ChainUnit head = fetchHead(endpoint);
        ChainUnit reference = fetchReference(endpoint, head, s);
        reference = refineWindow(endpoint, head, reference, s);

        long units = head.height() - reference.height();
        double seconds = windowSeconds(head, reference, units, s);
        double average = averageTransactions(endpoint, reference.height(), head.height(), s.getSampleSize());
        double tps = average * units / seconds;

        Double exact = exactTotal(endpoint, head);
        double total = exact != null ? exact : head.height() * average;
        log.debug("{} {}: units={} seconds={} avgTx={} tps={}", getClass().getSimpleName(), target.chainId(),
                units, seconds, average, tps);
        return MeasurementResult.success(target, endpoint, tps, total);
    }

    private ChainUnit fetchReference(String endpoint, ChainUnit head, WindowSettings s) {
        List<Long> lookbacks = new ArrayList<>();
        lookbacks.add(s.getLookback());
        if (s.getFallbackLookbacks() != null) {
            lookbacks.addAll(s.getFallbackLookbacks());
        }
        for (long lookback : lookbacks) {
            checkInterrupted();
            long height = Math.max(firstHeight(), head.height() - lookback);
            if (height >= head.height()) {
                continue;
            }
            try {
                return fetchUnit(endpoint, height);
            } catch (FetchException | SampleException e) {
                log.debug("Reference unit {} unavailable at {}: {}", height, endpoint, e.getMessage());
            }
        }
        throw new SampleException(SampleException.NO_START_BLOCK);
    }

    /**
     * Moves the reference so the window covers about {@code targetWindowSeconds}, using the unit time observed between
     * head and the first reference. When the refined unit cannot be fetched the first reference is kept if its window
     * is already longer than {@code refinementKeepSeconds}.
     */
    private ChainUnit refineWindow(String endpoint, ChainUnit head, ChainUnit reference, WindowSettings s) {
        Long target = s.getTargetWindowSeconds();
        if (target == null || !head.hasTimestamp() || !reference.hasTimestamp()) {
            return reference;
        }
        double observed = head.timestampSeconds() - reference.timestampSeconds();
        long units = head.height() - reference.height();
        if (observed <= 0 || units <= 0) {
            return reference;
        }
        double unitTime = observed / units;
        long needed = Math.max(1L, (long) (target / unitTime));
        long height = Math.max(firstHeight(), head.height() - needed);
        if (height == reference.height()) {
            return reference;
        }
        checkInterrupted();
        try {
            ChainUnit refined = fetchUnit(endpoint, height);
            return refined.hasTimestamp() ? refined : reference;
        } catch (FetchException | SampleException e) {
            if (observed > s.getRefinementKeepSeconds()) {
                return reference;
            }
            throw new SampleException(SampleException.NO_START_BLOCK, e);
        }
    }

    private static double windowSeconds(ChainUnit head, ChainUnit reference, long units, WindowSettings s) {
        Double assumed = s.getAssumedBlockTimeSeconds();
        if (head.hasTimestamp() && reference.hasTimestamp()) {
            double seconds = Math.max(head.timestampSeconds() - reference.timestampSeconds(), 1.0);
            Double min = s.getMinWindowSeconds();
            if (assumed != null && min != null && seconds < min) {
                return units * assumed;
            }
            return seconds;
        }
        if (assumed != null) {
            return Math.max(units * assumed, 1.0);
        }
        throw new SampleException("no_timestamps");
    }

    private double averageTransactions(String endpoint, long referenceHeight, long headHeight, int sampleSize) {
        long total = 0;
        int valid = 0;
        for (long height : samplePoints(referenceHeight, headHeight, sampleSize)) {
            checkInterrupted();
            try {
                total += countTransactions(endpoint, height);
                valid++;
            } catch (FetchException | SampleException e) {
                log.debug("Sample unit {} skipped at {}: {}", height, endpoint, e.getMessage());
            }
        }
        if (valid == 0) {
            throw new SampleException(SampleException.NO_VALID_SAMPLES);
        }
        return (double) total / valid;
    }

    /**
     * Every unit after the reference when the range fits the sample size, otherwise {@code sampleSize} evenly spaced
     * units starting right after the reference.
     */
    static List<Long> samplePoints(long referenceHeight, long headHeight, int sampleSize) {
        long range = headHeight - referenceHeight;
        List<Long> points = new ArrayList<>();
        if (range <= sampleSize) {
            for (long h = referenceHeight + 1; h <= headHeight; h++) {
                points.add(h);
            }
            return points;
        }
        long step = range / Math.max(1, sampleSize);
        for (int i = 0; i < sampleSize; i++) {
            long h = referenceHeight + 1 + i * step;
            if (h <= headHeight) {
                points.add(h);
            }
        }
        return points;
    }

    protected static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new SampleException("interrupted");
        }
    }

    /** Converts a raw timestamp in {@code unit} to seconds. */
    protected static double toSeconds(double raw, ChronoUnit unit) {
        return raw / (1_000_000_000.0 / unit.getDuration().toNanos());
    }

    /** Reads a number given as JSON number, decimal string or 0x-prefixed hex string. */
    protected static long asLong(JsonNode node, String field) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new SampleException("missing_" + field);
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        String text = node.asText().trim();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Long.parseLong(text.substring(2), 16);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new SampleException("invalid_" + field, e);
        }
    }

    /** Endpoint without trailing slashes, for appending REST paths. */
    protected static String baseUrl(String endpoint) {
        String s = endpoint.trim();
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    /** Non-null object result or SampleException("missing_&lt;what&gt;"). */
    protected static JsonNode require(JsonNode node, String what) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new SampleException("missing_" + what);
        }
        return node;
    }
}
