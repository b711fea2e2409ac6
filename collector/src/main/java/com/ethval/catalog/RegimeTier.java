package com.ethval.catalog;

import com.ethval.domain.SourceTag;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded pseudo-random estimate: each day takes a uniform draw from the band of the regime in force.
 * The bands are placeholder constants, not measurements; records are tagged {@code estimated}.
 */
public record RegimeTier(List<Regime> regimes) implements TierSpec {

    public RegimeTier {
        regimes = List.copyOf(regimes);
    }

    public static RegimeTier of(Regime... regimes) {
        return new RegimeTier(List.of(regimes));
    }

    @Override
    public String sourceTag() {
        return SourceTag.ESTIMATED;
    }

    @Override
    public Set<String> producedFields() {
        Set<String> fields = new LinkedHashSet<>();
        regimes.forEach(r -> fields.addAll(r.bands().keySet()));
        return fields;
    }

    @Override
    public boolean synthetic() {
        return true;
    }
}
