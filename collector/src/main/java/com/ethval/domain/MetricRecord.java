package com.ethval.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One normalized row of a metric series. Values are typed by the metric's record schema at normalization
 * time: {@link BigDecimal} for decimals, {@link Long} for integers, {@link String} for text. A null value
 * means the field is unknown for that day.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MetricRecord {

    private final LocalDate date;
    /** Unix seconds at 00:00 UTC; redundant with {@link #date}, absent for series that do not store it. */
    private final Long timestamp;
    private final String dimension;
    private final Map<String, Object> values;
    private final String source;

    public MetricRecord(LocalDate date, Long timestamp, String dimension, Map<String, Object> values, String source) {
        this.date = Objects.requireNonNull(date, "date");
        this.timestamp = timestamp;
        this.dimension = dimension;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.source = Objects.requireNonNull(source, "source");
    }

    public RecordKey key() {
        return new RecordKey(date, dimension);
    }

    public Object value(String field) {
        return values.get(field);
    }

    public boolean has(String field) {
        return values.get(field) != null;
    }

    public BigDecimal decimal(String field) {
        Object v = values.get(field);
        if (v == null) {
            return null;
        }
        if (v instanceof BigDecimal d) {
            return d;
        }
        if (v instanceof Long l) {
            return BigDecimal.valueOf(l);
        }
        throw new IllegalStateException("Field " + field + " is not numeric: " + v);
    }

    public Long integer(String field) {
        Object v = values.get(field);
        if (v == null) {
            return null;
        }
        if (v instanceof Long l) {
            return l;
        }
        if (v instanceof BigDecimal d) {
            return d.longValue();
        }
        throw new IllegalStateException("Field " + field + " is not numeric: " + v);
    }

    public String text(String field) {
        Object v = values.get(field);
        return v == null ? null : v.toString();
    }

    /**
     * Copy with the non-null entries of {@code overlay} replacing this record's values; key and source unchanged.
     */
    public MetricRecord withValues(Map<String, Object> overlay) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        overlay.forEach((k, v) -> {
            if (v != null) {
                merged.put(k, v);
            }
        });
        return new MetricRecord(date, timestamp, dimension, merged, source);
    }

    public MetricRecord withSource(String newSource) {
        return new MetricRecord(date, timestamp, dimension, values, newSource);
    }
}
