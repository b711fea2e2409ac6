package com.ethval.ingestion.synthetic;

import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.Regime;
import com.ethval.catalog.ValueRange;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import com.ethval.domain.SourceTag;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Bounded estimate for metrics without a historical source: each day of the window draws every banded
 * field uniformly from the regime in force that day. Only range membership is deterministic.
 */
@Component
public class RegimeEstimator {

    public List<MetricRecord> estimate(List<Regime> regimes, RecordSchema schema, DateWindow window, Random random) {
        List<MetricRecord> records = new ArrayList<>(window.days());
        for (LocalDate date : window.dates()) {
            Regime regime = regimeFor(regimes, date);
            if (regime == null) {
                continue;
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (FieldSpec field : schema.fields()) {
                ValueRange band = regime.bands().get(field.name());
                values.put(field.name(), band == null ? null : draw(field, band, random));
            }
            Long timestamp = schema.storesTimestamp() ? DateWindow.epochSeconds(date) : null;
            records.add(new MetricRecord(date, timestamp, null, values, SourceTag.ESTIMATED));
        }
        return records;
    }

    /** Latest regime starting on or before {@code date}; regimes are declared in start order. */
    static Regime regimeFor(List<Regime> regimes, LocalDate date) {
        Regime found = null;
        for (Regime r : regimes) {
            if (r.appliesFrom(date)) {
                found = r;
            }
        }
        return found;
    }

    private static Object draw(FieldSpec field, ValueRange band, Random random) {
        BigDecimal span = band.max().subtract(band.min());
        BigDecimal raw = band.min().add(span.multiply(BigDecimal.valueOf(random.nextDouble()), MathContext.DECIMAL64));
        return clampRounded(field, raw, band);
    }

    private static Object clampRounded(FieldSpec field, BigDecimal raw, ValueRange band) {
        Object typed = Interpolator.typed(field, raw);
        BigDecimal value = typed instanceof Long l ? BigDecimal.valueOf(l) : (BigDecimal) typed;
        if (value.compareTo(band.min()) < 0) {
            return Interpolator.typed(field, band.min());
        }
        if (value.compareTo(band.max()) > 0) {
            return Interpolator.typed(field, band.max());
        }
        return typed;
    }
}
