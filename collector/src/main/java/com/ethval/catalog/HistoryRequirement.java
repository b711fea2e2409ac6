package com.ethval.catalog;

/**
 * How much a live tier must return before later tiers are skipped.
 */
public enum HistoryRequirement {
    /** At least the configured minimum row count (100 by default). */
    LONG_HISTORY,
    /** Any non-empty result; the source only offers a current value. */
    SNAPSHOT
}
