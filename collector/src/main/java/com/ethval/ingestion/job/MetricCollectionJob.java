package com.ethval.ingestion.job;

import com.ethval.catalog.MetricDefinition;
import com.ethval.common.RunDeadline;
import com.ethval.domain.CollectionStatus.CollectionStatusValue;
import com.ethval.domain.DateWindow;
import com.ethval.ingestion.adapter.FetchContext;
import com.ethval.ingestion.config.CollectorProperties;
import com.ethval.ingestion.resolver.QualityTag;
import com.ethval.ingestion.resolver.ResolvedSeries;
import com.ethval.ingestion.resolver.TieredResolver;
import com.ethval.ingestion.status.CollectionLogWriter;
import com.ethval.ingestion.status.CollectionStatusTracker;
import com.ethval.ingestion.status.StatusFields;
import com.ethval.ingestion.store.IdempotentBatchWriter;
import com.ethval.ingestion.store.WriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects one metric end to end: resolve tiers, write batches, record status and a run log entry.
 * Every failure stops at this boundary and becomes a FAILED status; other metrics are unaffected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricCollectionJob {

    private final TieredResolver resolver;
    private final IdempotentBatchWriter writer;
    private final CollectionStatusTracker statusTracker;
    private final CollectionLogWriter logWriter;
    private final CollectorProperties properties;
    private final Clock clock;

    public MetricRunOutcome run(MetricDefinition metric, RunDeadline deadline) {
        DateWindow window = DateWindow.ending(LocalDate.now(clock), properties.getDaysToFetch());
        FetchContext context = new FetchContext(metric, window, null, deadline);
        log.info("{} collecting {} to {} into {}", context.label(), window.from(), window.to(), metric.collection());
        try {
            deadline.check(metric.name());
            ResolvedSeries series = resolver.resolve(metric, context);
            WriteResult written = writer.write(metric, series.records(), deadline);
            CollectionStatusValue status = series.quality() == QualityTag.SUCCESS
                    ? CollectionStatusValue.SUCCESS
                    : CollectionStatusValue.PARTIAL;
            String warning = series.warningSummary();
            statusTracker.update(metric.name(), status, new StatusFields(written.count(), written.dateFrom(),
                    written.dateTo(), null, warning));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("quality", series.quality().name());
            details.put("records", written.count());
            details.put("batches", written.batches());
            details.put("tiers", series.outcomes().stream()
                    .map(o -> o.source() + (o.dimension() == null ? "" : "/" + o.dimension())
                            + (o.succeeded() ? ":" + o.added() : ":failed"))
                    .toList());
            logWriter.info(metric.name(), "Collected " + written.count() + " records", details);
            if (warning != null) {
                logWriter.warning(metric.name(), warning, Map.of("quality", series.quality().name()));
                log.warn("{} completed as {}: {}", context.label(), status, warning);
            }
            log.info("{} {} with {} records ({} to {})", context.label(), status, written.count(),
                    written.dateFrom(), written.dateTo());
            return new MetricRunOutcome(metric.name(), status, written.count(), warning);
        } catch (RuntimeException e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("{} failed: {}", context.label(), error, e);
            recordFailure(metric.name(), error);
            return MetricRunOutcome.failed(metric.name(), error);
        }
    }

    /**
     * Marks a metric that never started (run cancelled or deadline passed).
     */
    public MetricRunOutcome skip(MetricDefinition metric, String reason) {
        log.warn("[{}] not started: {}", metric.name(), reason);
        recordFailure(metric.name(), reason);
        return MetricRunOutcome.failed(metric.name(), reason);
    }

    private void recordFailure(String dataset, String error) {
        try {
            statusTracker.markFailed(dataset, error);
        } catch (RuntimeException statusError) {
            log.error("[{}] could not record failed status: {}", dataset, statusError.getMessage());
        }
        logWriter.error(dataset, error, Map.of());
    }
}
