package com.ethval.ingestion.resolver;

import com.ethval.domain.MetricRecord;

import java.util.List;

/**
 * Final records of a metric, unique per key and sorted by date then dimension.
 */
public record ResolvedSeries(List<MetricRecord> records, QualityTag quality, List<String> warnings,
                             List<TierOutcome> outcomes) {

    public ResolvedSeries {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
        outcomes = List.copyOf(outcomes);
    }

    public String warningSummary() {
        return warnings.isEmpty() ? null : String.join("; ", warnings);
    }
}
