package com.ethval.catalog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trusted value(s) at a date. A null date stands for "today" and is resolved at run time.
 */
public record Anchor(LocalDate date, Map<String, BigDecimal> values) {

    public Anchor {
        values = Map.copyOf(values);
    }

    public static Anchor on(String isoDate, Map<String, ? extends Number> values) {
        return new Anchor(LocalDate.parse(isoDate), toDecimals(values));
    }

    public static Anchor today(Map<String, ? extends Number> values) {
        return new Anchor(null, toDecimals(values));
    }

    public LocalDate resolveDate(LocalDate today) {
        return date == null ? today : date;
    }

    private static Map<String, BigDecimal> toDecimals(Map<String, ? extends Number> values) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, new BigDecimal(v.toString())));
        return out;
    }
}
