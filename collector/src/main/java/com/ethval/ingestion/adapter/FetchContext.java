package com.ethval.ingestion.adapter;

import com.ethval.catalog.MetricDefinition;
import com.ethval.common.RunDeadline;
import com.ethval.domain.DateWindow;

/**
 * What one tier fetch is for: the metric, its window, and the dimension for composite-keyed series
 * (null otherwise).
 */
public record FetchContext(MetricDefinition metric, DateWindow window, String dimension, RunDeadline deadline) {

    public FetchContext forDimension(String newDimension) {
        return new FetchContext(metric, window, newDimension, deadline);
    }

    /** {@code [eth_price]} or {@code [l2_tvl/Arbitrum]}, used as log prefix. */
    public String label() {
        return dimension == null ? "[" + metric.name() + "]" : "[" + metric.name() + "/" + dimension + "]";
    }
}
