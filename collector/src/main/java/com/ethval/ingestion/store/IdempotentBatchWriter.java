package com.ethval.ingestion.store;

import com.ethval.catalog.MetricDefinition;
import com.ethval.common.RunCancelledException;
import com.ethval.common.RunDeadline;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.config.CollectorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes a resolved series in consecutive batches of {@code ethval.collector.batch-size}. Each batch is an
 * upsert on the natural key, so replaying a batch or a whole run leaves the collection unchanged.
 * Batches run sequentially; the first failing batch aborts the remaining ones.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotentBatchWriter {

    private final MetricStore store;
    private final CollectorProperties properties;

    /**
     * @param records sorted by key, unique per key
     * @throws WriteFailureException when a batch fails
     * @throws RunCancelledException when the run deadline passes between batches
     */
    public WriteResult write(MetricDefinition metric, List<MetricRecord> records, RunDeadline deadline) {
        if (records.isEmpty()) {
            return WriteResult.empty();
        }
        store.ensureIndexes(metric.collection(), metric.key());
        int batchSize = properties.getBatchSize();
        int written = 0;
        int batches = 0;
        for (int start = 0; start < records.size(); start += batchSize) {
            deadline.check("batch " + (batches + 1) + " of " + metric.name());
            List<MetricRecord> batch = records.subList(start, Math.min(start + batchSize, records.size()));
            try {
                store.upsert(metric.collection(), batch, metric.key());
            } catch (RuntimeException e) {
                throw new WriteFailureException("Batch " + (batches + 1) + " of " + metric.collection()
                        + " failed after " + written + " records: " + e.getMessage(), written, e);
            }
            written += batch.size();
            batches++;
            log.info("[{}] Saved {}/{} records", metric.name(), written, records.size());
        }
        return new WriteResult(written, batches, records.get(0).getDate(),
                records.get(records.size() - 1).getDate());
    }
}
