package com.ethval.catalog;

import java.math.BigDecimal;

/**
 * Plausibility bounds for a numeric field; values outside are treated as missing. Null bound = unbounded.
 */
public record ValidRange(BigDecimal min, boolean minInclusive, BigDecimal max, boolean maxInclusive) {

    public static ValidRange positive() {
        return new ValidRange(BigDecimal.ZERO, false, null, false);
    }

    public static ValidRange nonNegative() {
        return new ValidRange(BigDecimal.ZERO, true, null, false);
    }

    public static ValidRange between(String min, String max) {
        return new ValidRange(new BigDecimal(min), true, new BigDecimal(max), true);
    }

    public static ValidRange exclusive(String min, String max) {
        return new ValidRange(new BigDecimal(min), false, new BigDecimal(max), false);
    }

    public boolean contains(BigDecimal value) {
        if (min != null) {
            int c = value.compareTo(min);
            if (c < 0 || (c == 0 && !minInclusive)) {
                return false;
            }
        }
        if (max != null) {
            int c = value.compareTo(max);
            return c < 0 || (c == 0 && maxInclusive);
        }
        return true;
    }
}
