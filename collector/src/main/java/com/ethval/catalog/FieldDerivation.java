package com.ethval.catalog;

import com.ethval.domain.MetricRecord;

import java.util.function.Function;

/**
 * Fills {@code targetField} from other fields of the same record when the source left it null.
 * The rule returns null when it cannot compute a value.
 */
public record FieldDerivation(String targetField, Function<MetricRecord, Object> rule) {
}
