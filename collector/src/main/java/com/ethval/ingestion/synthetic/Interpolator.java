package com.ethval.ingestion.synthetic;

import com.ethval.catalog.Anchor;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.FieldType;
import com.ethval.catalog.RecordSchema;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import com.ethval.domain.SourceTag;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily values between consecutive anchors {@code (d0, v0), (d1, v1)}: one record per day in
 * {@code [d0, d1)} with {@code v0 + (v1 - v0) * (d - d0) / (d1 - d0)}, rounded to the field's scale and
 * kept within {@code [min(v0, v1), max(v0, v1)]}. The last anchor is emitted once with its exact values.
 * Intervals with {@code d1 <= d0} are skipped; nothing is extrapolated past the last anchor.
 */
@Component
public class Interpolator {

    /**
     * @param today date that "today" anchors resolve to
     */
    public List<MetricRecord> interpolate(List<Anchor> anchors, RecordSchema schema, LocalDate today) {
        if (anchors.isEmpty()) {
            return List.of();
        }
        Map<LocalDate, MetricRecord> byDate = new LinkedHashMap<>();
        for (int i = 0; i < anchors.size() - 1; i++) {
            Anchor start = anchors.get(i);
            Anchor end = anchors.get(i + 1);
            LocalDate d0 = start.resolveDate(today);
            LocalDate d1 = end.resolveDate(today);
            long days = ChronoUnit.DAYS.between(d0, d1);
            if (days <= 0) {
                continue;
            }
            for (long d = 0; d < days; d++) {
                LocalDate date = d0.plusDays(d);
                if (byDate.containsKey(date)) {
                    continue;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (FieldSpec field : schema.fields()) {
                    BigDecimal v0 = start.values().get(field.name());
                    BigDecimal v1 = end.values().get(field.name());
                    values.put(field.name(), v0 == null || v1 == null ? null : between(field, v0, v1, d, days));
                }
                byDate.put(date, record(date, values, schema));
            }
        }
        Anchor last = anchors.get(anchors.size() - 1);
        LocalDate lastDate = last.resolveDate(today);
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec field : schema.fields()) {
            BigDecimal v = last.values().get(field.name());
            values.put(field.name(), v == null ? null : typed(field, v));
        }
        byDate.put(lastDate, record(lastDate, values, schema));
        return new ArrayList<>(byDate.values());
    }

    static Object between(FieldSpec field, BigDecimal v0, BigDecimal v1, long step, long steps) {
        BigDecimal fraction = BigDecimal.valueOf(step).divide(BigDecimal.valueOf(steps), MathContext.DECIMAL64);
        BigDecimal raw = v0.add(v1.subtract(v0).multiply(fraction, MathContext.DECIMAL64));
        BigDecimal rounded = round(field, raw);
        BigDecimal lo = v0.min(v1);
        BigDecimal hi = v0.max(v1);
        if (rounded.compareTo(lo) < 0) {
            rounded = lo;
        } else if (rounded.compareTo(hi) > 0) {
            rounded = hi;
        }
        return field.type() == FieldType.INTEGER ? (Object) rounded.longValue() : rounded;
    }

    static Object typed(FieldSpec field, BigDecimal value) {
        BigDecimal rounded = round(field, value);
        return field.type() == FieldType.INTEGER ? (Object) rounded.longValue() : rounded;
    }

    private static BigDecimal round(FieldSpec field, BigDecimal value) {
        int scale = field.type() == FieldType.INTEGER ? 0 : field.scale();
        return value.setScale(scale, RoundingMode.HALF_UP);
    }

    private static MetricRecord record(LocalDate date, Map<String, Object> values, RecordSchema schema) {
        Long timestamp = schema.storesTimestamp() ? DateWindow.epochSeconds(date) : null;
        return new MetricRecord(date, timestamp, null, values, SourceTag.INTERPOLATED);
    }
}
