package com.ethval.catalog;

import com.ethval.domain.SourceTag;

import java.util.Set;

/**
 * Tier computed from another metric's persisted records: annualised rolling volatility of daily
 * log returns of {@code sourceField}, in percent.
 */
public record DerivedTier(String sourceCollection, String sourceField, int windowDays, String targetField)
        implements TierSpec {

    @Override
    public String sourceTag() {
        return SourceTag.DERIVED;
    }

    @Override
    public Set<String> producedFields() {
        return Set.of(targetField);
    }
}
