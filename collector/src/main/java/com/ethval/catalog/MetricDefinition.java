package com.ethval.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of one metric series: where it is stored, how it is keyed, which typed fields
 * it has and which tiers feed it in priority order.
 */
public record MetricDefinition(String name, String collection, KeyDefinition key, RecordSchema schema,
                               HistoryRequirement history, List<TierSpec> tiers, List<EnrichmentSpec> enrichments,
                               List<FieldDerivation> derivations) {

    public MetricDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(history, "history");
        tiers = List.copyOf(tiers);
        enrichments = List.copyOf(enrichments);
        derivations = List.copyOf(derivations);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Distinct keys a live tier must reach per dimension before the remaining tiers are skipped.
     */
    public int minRows(int longHistoryThreshold) {
        return history == HistoryRequirement.SNAPSHOT ? 1 : longHistoryThreshold;
    }

    public boolean endsWithSyntheticTier() {
        return !tiers.isEmpty() && tiers.get(tiers.size() - 1).synthetic();
    }

    public static final class Builder {
        private final String name;
        private String collection;
        private KeyDefinition key = KeyDefinition.dateOnly();
        private RecordSchema schema;
        private HistoryRequirement history = HistoryRequirement.LONG_HISTORY;
        private final List<TierSpec> tiers = new ArrayList<>();
        private final List<EnrichmentSpec> enrichments = new ArrayList<>();
        private final List<FieldDerivation> derivations = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
            this.collection = "historical_" + name;
        }

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder key(KeyDefinition key) {
            this.key = key;
            return this;
        }

        public Builder schema(RecordSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder snapshot() {
            this.history = HistoryRequirement.SNAPSHOT;
            return this;
        }

        public Builder tier(TierSpec tier) {
            this.tiers.add(tier);
            return this;
        }

        public Builder enrich(EnrichmentSpec enrichment) {
            this.enrichments.add(enrichment);
            return this;
        }

        public Builder derive(FieldDerivation derivation) {
            this.derivations.add(derivation);
            return this;
        }

        public MetricDefinition build() {
            return new MetricDefinition(name, collection, key, schema, history, tiers, enrichments, derivations);
        }
    }
}
