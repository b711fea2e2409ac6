package com.ethval.ingestion.job;

import com.ethval.catalog.MetricCatalog;
import com.ethval.catalog.MetricDefinition;
import com.ethval.common.RunDeadline;
import com.ethval.config.AsyncConfig;
import com.ethval.ingestion.config.CollectorProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the collection of every requested metric. Sequential by default with a pause between metrics;
 * with {@code parallelism > 1} metrics run on the collector executor while each metric keeps its own
 * tier and batch order. The run deadline is checked before every metric; metrics that never started
 * are recorded as FAILED.
 */
@Slf4j
@Component
public class CollectionRunOrchestrator {

    private static final String RUN_CANCELLED = "run cancelled";

    private final MetricCatalog catalog;
    private final MetricCollectionJob job;
    private final CollectorProperties properties;
    private final Clock clock;
    private final Executor collectorExecutor;
    private volatile RunDeadline currentRun;

    public CollectionRunOrchestrator(MetricCatalog catalog, MetricCollectionJob job, CollectorProperties properties,
                                     Clock clock, @Qualifier(AsyncConfig.COLLECTOR_EXECUTOR) Executor collectorExecutor) {
        this.catalog = catalog;
        this.job = job;
        this.properties = properties;
        this.clock = clock;
        this.collectorExecutor = collectorExecutor;
    }

    /**
     * @param only metric names to run; empty runs the whole catalog in catalog order
     * @throws IllegalArgumentException for an unknown metric name
     */
    public RunSummary runAll(List<String> only) {
        List<MetricDefinition> metrics = only == null || only.isEmpty()
                ? catalog.all()
                : only.stream().map(catalog::get).toList();
        RunDeadline deadline = new RunDeadline(clock, properties.getRunTimeout());
        currentRun = deadline;
        Instant started = clock.instant();
        log.info("==== Collection run: {} metrics, {} days, parallelism {} ====", metrics.size(),
                properties.getDaysToFetch(), properties.getParallelism());
        RunSummary summary = new RunSummary();
        try {
            if (properties.getParallelism() <= 1) {
                runSequential(metrics, deadline, summary);
            } else {
                runParallel(metrics, deadline, summary);
            }
        } finally {
            currentRun = null;
        }
        logSummary(summary, Duration.between(started, clock.instant()));
        return summary;
    }

    /** Cancels the run in progress; running metrics stop at their next checkpoint. */
    public void cancel() {
        RunDeadline run = currentRun;
        if (run != null) {
            log.warn("Cancelling collection run");
            run.cancel();
        }
    }

    @PreDestroy
    void onShutdown() {
        cancel();
    }

    private void runSequential(List<MetricDefinition> metrics, RunDeadline deadline, RunSummary summary) {
        for (int i = 0; i < metrics.size(); i++) {
            MetricDefinition metric = metrics.get(i);
            summary.record(runOrSkip(metric, deadline));
            if (i < metrics.size() - 1) {
                pause(deadline);
            }
        }
    }

    private void runParallel(List<MetricDefinition> metrics, RunDeadline deadline, RunSummary summary) {
        List<CompletableFuture<Void>> futures = metrics.stream()
                .map(metric -> CompletableFuture
                        .supplyAsync(() -> runOrSkip(metric, deadline), collectorExecutor)
                        .thenAccept(summary::record))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    private MetricRunOutcome runOrSkip(MetricDefinition metric, RunDeadline deadline) {
        if (deadline.isExpired()) {
            return job.skip(metric, RUN_CANCELLED);
        }
        return job.run(metric, deadline);
    }

    private void pause(RunDeadline deadline) {
        long delayMs = properties.getInterMetricDelayMs();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deadline.cancel();
        }
    }

    private void logSummary(RunSummary summary, Duration elapsed) {
        log.info("==== Collection finished in {}s: {} succeeded, {} partial, {} failed, {} records ====",
                elapsed.toSeconds(), summary.getSucceeded(), summary.getPartial(), summary.getFailed(),
                summary.getRecords());
        if (summary.getFailed() > 0) {
            log.warn("Failed metrics: {}", String.join(", ", summary.getFailedMetrics()));
        }
    }
}
