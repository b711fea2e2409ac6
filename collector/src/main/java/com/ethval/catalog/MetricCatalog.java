package com.ethval.catalog;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * All tracked metrics in run order. Validated once at construction; an invalid catalog fails startup.
 */
@Component
public class MetricCatalog {

    private final List<MetricDefinition> definitions;

    public MetricCatalog(List<MetricGroup> groups) {
        this.definitions = groups.stream().flatMap(g -> g.definitions().stream()).toList();
        validate(definitions);
    }

    public List<MetricDefinition> all() {
        return definitions;
    }

    public Optional<MetricDefinition> find(String name) {
        return definitions.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    public MetricDefinition get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + name));
    }

    public int size() {
        return definitions.size();
    }

    /**
     * @throws IllegalStateException on the first rule a definition breaks
     */
    static void validate(List<MetricDefinition> definitions) {
        Set<String> names = new HashSet<>();
        Set<String> collections = new HashSet<>();
        for (MetricDefinition d : definitions) {
            if (!names.add(d.name())) {
                throw new IllegalStateException("Duplicate metric name: " + d.name());
            }
            if (!collections.add(d.collection())) {
                throw new IllegalStateException("Duplicate collection: " + d.collection());
            }
            if (d.tiers().isEmpty()) {
                throw new IllegalStateException(d.name() + ": no tiers");
            }
            if (!d.key().isComposite() && !d.endsWithSyntheticTier()) {
                throw new IllegalStateException(d.name() + ": single-series metric must end with a synthetic tier");
            }
            Set<String> schemaFields = d.schema().fieldNames();
            for (TierSpec tier : d.tiers()) {
                checkFields(d, tier, schemaFields);
            }
            for (EnrichmentSpec e : d.enrichments()) {
                checkFields(d, e.tier(), schemaFields);
            }
            d.tiers().stream()
                    .filter(InterpolationTier.class::isInstance)
                    .map(InterpolationTier.class::cast)
                    .forEach(t -> checkAnchors(d, t));
        }
    }

    private static void checkFields(MetricDefinition d, TierSpec tier, Set<String> schemaFields) {
        for (String field : tier.producedFields()) {
            if (!schemaFields.contains(field)) {
                throw new IllegalStateException(d.name() + ": tier " + tier.sourceTag() + " fills unknown field " + field);
            }
        }
    }

    private static void checkAnchors(MetricDefinition d, InterpolationTier tier) {
        List<Anchor> anchors = tier.anchors();
        if (anchors.size() < 2 || anchors.get(anchors.size() - 1).date() != null) {
            throw new IllegalStateException(d.name() + ": interpolation needs at least two anchors ending today");
        }
        LocalDate previous = null;
        for (Anchor a : anchors.subList(0, anchors.size() - 1)) {
            if (a.date() == null || (previous != null && !a.date().isAfter(previous))) {
                throw new IllegalStateException(d.name() + ": anchors must be dated and strictly ascending");
            }
            previous = a.date();
        }
    }
}
