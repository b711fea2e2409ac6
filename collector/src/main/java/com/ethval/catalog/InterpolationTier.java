package com.ethval.catalog;

import com.ethval.domain.SourceTag;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Daily values linearly interpolated between sparse milestones; the last anchor is today.
 */
public record InterpolationTier(List<Anchor> anchors) implements TierSpec {

    public InterpolationTier {
        anchors = List.copyOf(anchors);
    }

    public static InterpolationTier of(Anchor... anchors) {
        return new InterpolationTier(List.of(anchors));
    }

    @Override
    public String sourceTag() {
        return SourceTag.INTERPOLATED;
    }

    @Override
    public Set<String> producedFields() {
        Set<String> fields = new LinkedHashSet<>();
        anchors.forEach(a -> fields.addAll(a.values().keySet()));
        return fields;
    }

    @Override
    public boolean synthetic() {
        return true;
    }
}
