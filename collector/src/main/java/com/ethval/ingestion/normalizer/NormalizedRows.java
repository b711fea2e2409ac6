package com.ethval.ingestion.normalizer;

import com.ethval.domain.MetricRecord;

import java.util.List;

/**
 * Records of one tier after normalization, and how many raw rows were dropped.
 */
public record NormalizedRows(List<MetricRecord> records, int dropped) {
}
