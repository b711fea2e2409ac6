package com.ethval.ingestion.resolver;

/**
 * How trustworthy a resolved series is.
 */
public enum QualityTag {
    /** Every dimension resolved from live sources. */
    SUCCESS,
    /** At least one dimension of a composite series could not be resolved. */
    PARTIAL,
    /** Some records come from interpolation or regime estimates. */
    ESTIMATED
}
