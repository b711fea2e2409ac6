package com.ethval.catalog;

import java.math.BigDecimal;

/**
 * Inclusive band a regime estimate is drawn from.
 */
public record ValueRange(BigDecimal min, BigDecimal max) {

    public ValueRange {
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
    }

    public static ValueRange of(Number min, Number max) {
        return new ValueRange(new BigDecimal(min.toString()), new BigDecimal(max.toString()));
    }

    public boolean contains(BigDecimal value) {
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }
}
