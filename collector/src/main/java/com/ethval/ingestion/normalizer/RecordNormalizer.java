package com.ethval.ingestion.normalizer;

import com.ethval.catalog.FieldDerivation;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.FieldType;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.RecordSchema;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.adapter.RawRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw rows into typed records of the metric's schema: canonical UTC date, unit correction,
 * validity range, then HALF_UP rounding to the field's scale so unchanged inputs give identical records.
 * Values outside the validity range become null; a row missing a required field is dropped.
 */
@Slf4j
@Component
public class RecordNormalizer {

    /**
     * @throws UnparseableDateException   the row's date cannot be read
     * @throws UnparseableNumberException a numeric field holds text that is not a number
     * @throws NormalizationException     a required field is missing or out of range
     */
    public MetricRecord normalize(RawRow row, MetricDefinition metric, String dimension) {
        LocalDate date = row.dateToken() != null || row.timestampToken() == null
                ? DateNormalizer.parse(row.dateToken())
                : DateNormalizer.parse(row.timestampToken());
        RecordSchema schema = metric.schema();
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec field : schema.fields()) {
            values.put(field.name(), coerce(field, row.values().get(field.name())));
        }
        Long timestamp = schema.storesTimestamp() ? DateWindow.epochSeconds(date) : null;
        MetricRecord record = applyDerivations(metric,
                new MetricRecord(date, timestamp, dimension, values, row.source()));
        for (FieldSpec field : schema.fields()) {
            if (field.required() && !record.has(field.name())) {
                throw new NormalizationException("Required field " + field.name() + " missing on " + date);
            }
        }
        return record;
    }

    /**
     * Normalizes every row, dropping and counting the ones that fail.
     */
    public NormalizedRows normalizeAll(List<RawRow> rows, MetricDefinition metric, String dimension) {
        List<MetricRecord> records = new ArrayList<>(rows.size());
        int dropped = 0;
        for (RawRow row : rows) {
            try {
                records.add(normalize(row, metric, dimension));
            } catch (NormalizationException e) {
                dropped++;
                log.debug("[{}] dropped row from {}: {}", metric.name(), row.source(), e.getMessage());
            }
        }
        return new NormalizedRows(records, dropped);
    }

    /**
     * Fills null fields from the metric's derivations, in declaration order.
     */
    public MetricRecord applyDerivations(MetricDefinition metric, MetricRecord record) {
        MetricRecord current = record;
        for (FieldDerivation derivation : metric.derivations()) {
            if (current.has(derivation.targetField())) {
                continue;
            }
            FieldSpec field = metric.schema().field(derivation.targetField())
                    .orElseThrow(() -> new IllegalStateException(metric.name() + ": derivation of unknown field "
                            + derivation.targetField()));
            Object derived = coerce(field, derivation.rule().apply(current));
            if (derived != null) {
                current = current.withValues(Map.of(field.name(), derived));
            }
        }
        return current;
    }

    /**
     * Typed value of {@code raw} for the field, or null when absent or outside the validity range.
     */
    public Object coerce(FieldSpec field, Object raw) {
        if (raw == null) {
            return null;
        }
        if (field.type() == FieldType.TEXT) {
            String text = raw.toString().trim();
            return text.isEmpty() ? null : text;
        }
        BigDecimal number = toDecimal(field, raw);
        if (number == null) {
            return null;
        }
        number = field.unitHint().rescale(number);
        if (field.validRange() != null && !field.validRange().contains(number)) {
            return null;
        }
        if (field.type() == FieldType.INTEGER) {
            return number.setScale(0, RoundingMode.HALF_UP).longValue();
        }
        return number.setScale(field.scale(), RoundingMode.HALF_UP);
    }

    private static BigDecimal toDecimal(FieldSpec field, Object raw) {
        if (raw instanceof BigDecimal d) {
            return d;
        }
        if (raw instanceof Long || raw instanceof Integer) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof Number n) {
            double v = n.doubleValue();
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                return null;
            }
            return BigDecimal.valueOf(v);
        }
        String text = raw.toString().trim().replace(",", "");
        if (text.isEmpty() || "null".equalsIgnoreCase(text) || "-".equals(text)) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new UnparseableNumberException(field.name(), raw);
        }
    }
}
