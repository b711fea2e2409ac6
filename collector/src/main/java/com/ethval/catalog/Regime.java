package com.ethval.catalog;

import java.time.LocalDate;
import java.util.Map;

/**
 * Historically plausible band per field, in force from {@code start} (inclusive) until the next regime.
 * A null start applies from the beginning of time.
 */
public record Regime(LocalDate start, Map<String, ValueRange> bands) {

    public Regime {
        bands = Map.copyOf(bands);
    }

    public static Regime from(String isoDate, Map<String, ValueRange> bands) {
        return new Regime(LocalDate.parse(isoDate), bands);
    }

    public static Regime initial(Map<String, ValueRange> bands) {
        return new Regime(null, bands);
    }

    public boolean appliesFrom(LocalDate day) {
        return start == null || !start.isAfter(day);
    }
}
