package com.chainguru.ingestion.job;

import com.chainguru.domain.MeasurementResult;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live counters for one measurement run. Updated by the dispatcher, readable from any thread.
 */
public class MeasurementRunProgress {

    private final int total;
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();

    public MeasurementRunProgress(int total) {
        this.total = total;
    }

    void record(MeasurementResult result) {
        switch (result.status()) {
            case SUCCESS -> succeeded.incrementAndGet();
            case ERROR -> failed.incrementAndGet();
            case SKIPPED -> skipped.incrementAndGet();
        }
        completed.incrementAndGet();
    }

    public int total() {
        return total;
    }

    public int completed() {
        return completed.get();
    }

    public int succeeded() {
        return succeeded.get();
    }

    public int failed() {
        return failed.get();
    }

    public int skipped() {
        return skipped.get();
    }

    public boolean isDone() {
        return completed.get() >= total;
    }

    @Override
    public String toString() {
        return completed.get() + "/" + total + " (succeeded=" + succeeded.get() + ", failed=" + failed.get()
                + ", skipped=" + skipped.get() + ")";
    }
}
