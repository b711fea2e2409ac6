package com.ethval.ingestion.job;

import com.ethval.domain.CollectionStatus.CollectionStatusValue;

/**
 * Result of one metric in a run. {@code message} carries the warning or error text, null on a clean success.
 */
public record MetricRunOutcome(String metric, CollectionStatusValue status, int recordCount, String message) {

    public static MetricRunOutcome failed(String metric, String error) {
        return new MetricRunOutcome(metric, CollectionStatusValue.FAILED, 0, error);
    }
}
