package com.ethval.catalog;

import java.util.Set;

/**
 * One ranked source of a metric. Implementations are plain declarations; fetching is done by the
 * source adapter that supports the tier type.
 */
public interface TierSpec {

    /** Tag written to {@code source} of every record this tier produces. */
    String sourceTag();

    /** Fields this tier fills; validated against the metric's record schema. */
    Set<String> producedFields();

    /** Synthetic tiers run without network access and cover the whole requested window. */
    default boolean synthetic() {
        return false;
    }
}
