package com.ethval.ingestion.job;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Aggregated outcome of a collection run. Safe to record into from several metric workers.
 */
public class RunSummary {

    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger partial = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger records = new AtomicInteger();
    private final Queue<String> failedMetrics = new ConcurrentLinkedQueue<>();

    public void record(MetricRunOutcome outcome) {
        switch (outcome.status()) {
            case SUCCESS -> succeeded.incrementAndGet();
            case PARTIAL -> partial.incrementAndGet();
            case FAILED -> {
                failed.incrementAndGet();
                failedMetrics.add(outcome.metric());
            }
            default -> throw new IllegalArgumentException("Unexpected run status " + outcome.status());
        }
        records.addAndGet(outcome.recordCount());
    }

    public int getSucceeded() {
        return succeeded.get();
    }

    public int getPartial() {
        return partial.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public int getRecords() {
        return records.get();
    }

    public int getTotal() {
        return succeeded.get() + partial.get() + failed.get();
    }

    public List<String> getFailedMetrics() {
        return List.copyOf(failedMetrics);
    }

    /** 0 when no metric failed, 1 otherwise. */
    public int exitCode() {
        return failed.get() == 0 ? 0 : 1;
    }
}
