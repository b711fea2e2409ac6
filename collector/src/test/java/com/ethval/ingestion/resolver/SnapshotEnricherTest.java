package com.ethval.ingestion.resolver;

import com.ethval.catalog.EnrichmentSpec;
import com.ethval.catalog.FieldDerivation;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.JsonRequest;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.Regime;
import com.ethval.catalog.RegimeTier;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.SourceApi;
import com.ethval.catalog.ValueRange;
import com.ethval.common.RunDeadline;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.adapter.FetchContext;
import com.ethval.ingestion.adapter.RawRow;
import com.ethval.ingestion.adapter.SourceAdapterRegistry;
import com.ethval.ingestion.adapter.SourceUnavailableException;
import com.ethval.ingestion.normalizer.RecordNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotEnricherTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private ScriptedSourceAdapter scripted;
    private SnapshotEnricher enricher;

    private static final MetricDefinition STAKING = MetricDefinition.builder("staking_data")
            .schema(RecordSchema.of(
                    FieldSpec.decimal("total_staked_eth", 2),
                    FieldSpec.integer("total_validators"),
                    FieldSpec.decimal("avg_apr", 4)))
            .tier(RegimeTier.of(Regime.initial(Map.of("avg_apr", ValueRange.of(3, 4)))))
            .enrich(EnrichmentSpec.replace(snapshot("beaconchain", "total_validators")))
            .enrich(EnrichmentSpec.overlay(snapshot("lido", "avg_apr")))
            .derive(new FieldDerivation("total_staked_eth",
                    r -> r.has("total_validators") ? BigDecimal.valueOf(r.integer("total_validators") * 32) : null))
            .build();

    @BeforeEach
    void setUp() {
        scripted = new ScriptedSourceAdapter();
        enricher = new SnapshotEnricher(new SourceAdapterRegistry(List.of(scripted)), new RecordNormalizer());
    }

    private static RestJsonTier snapshot(String tag, String field) {
        return RestJsonTier.of(tag, SourceApi.BEACONCHAIN,
                JsonRequest.get("{beaconchain}/" + tag).rows("/data").field(field, "/" + field).build());
    }

    private static FetchContext context() {
        return new FetchContext(STAKING, DateWindow.ending(TODAY, 3), null, RunDeadline.unbounded(Clock.systemUTC()));
    }

    private static MetricRecord interpolated(LocalDate date, long validators, String apr) {
        return new MetricRecord(date, DateWindow.epochSeconds(date), null, Map.of(
                "total_staked_eth", BigDecimal.valueOf(validators * 32),
                "total_validators", validators,
                "avg_apr", new BigDecimal(apr)), "interpolated");
    }

    private static RawRow today(String field, Object value, String source) {
        return new RawRow(TODAY.toString(), null, Map.of(field, value), source);
    }

    @Test
    @DisplayName("replace swaps today's record for the live snapshot, overlay then patches a field")
    void replaceThenOverlay() {
        List<MetricRecord> merged = List.of(
                interpolated(TODAY.minusDays(1), 1_000_000, "3.1"),
                interpolated(TODAY, 1_000_100, "3.1"));
        scripted.answer("beaconchain", c -> List.of(today("total_validators", 1_050_000, "beaconchain")))
                .answer("lido", c -> List.of(today("avg_apr", "2.9512", "lido")));
        List<String> warnings = new ArrayList<>();

        List<MetricRecord> out = enricher.enrich(merged, context(), warnings);

        assertThat(out).hasSize(2);
        assertThat(out.get(0)).isEqualTo(merged.get(0));
        MetricRecord current = out.get(1);
        assertThat(current.getSource()).isEqualTo("beaconchain");
        assertThat(current.value("total_validators")).isEqualTo(1_050_000L);
        assertThat(current.decimal("total_staked_eth")).isEqualByComparingTo("33600000");
        assertThat(current.decimal("avg_apr")).isEqualByComparingTo("2.9512");
        assertThat(warnings).isEmpty();
    }

    @Test
    void replaceAppendsWhenTodayIsMissing() {
        List<MetricRecord> merged = List.of(interpolated(TODAY.minusDays(1), 1_000_000, "3.1"));
        scripted.answer("beaconchain", c -> List.of(today("total_validators", 1_050_000, "beaconchain")))
                .answer("lido", c -> List.of(today("avg_apr", "2.95", "lido")));

        List<MetricRecord> out = enricher.enrich(merged, context(), new ArrayList<>());

        assertThat(out).extracting(MetricRecord::getDate).containsExactly(TODAY.minusDays(1), TODAY);
        assertThat(out.get(1).decimal("avg_apr")).isEqualByComparingTo("2.95");
    }

    @Test
    @DisplayName("overlay keeps the record's source and leaves other fields alone")
    void overlayOnly() {
        List<MetricRecord> merged = List.of(interpolated(TODAY, 1_000_100, "3.1"));
        scripted.fail("beaconchain", new SourceUnavailableException("HTTP 503"))
                .answer("lido", c -> List.of(today("avg_apr", "2.9", "lido")));
        List<String> warnings = new ArrayList<>();

        List<MetricRecord> out = enricher.enrich(merged, context(), warnings);

        assertThat(out).singleElement().satisfies(r -> {
            assertThat(r.getSource()).isEqualTo("interpolated");
            assertThat(r.decimal("avg_apr")).isEqualByComparingTo("2.9");
            assertThat(r.value("total_validators")).isEqualTo(1_000_100L);
        });
        assertThat(warnings).singleElement().asString().contains("beaconchain").contains("HTTP 503");
    }

    @Test
    void overlayWithoutTodaysRecordDoesNothing() {
        List<MetricRecord> merged = List.of(interpolated(TODAY.minusDays(2), 1_000_000, "3.1"));
        scripted.fail("beaconchain", new SourceUnavailableException("down"))
                .answer("lido", c -> List.of(today("avg_apr", "2.9", "lido")));

        List<MetricRecord> out = enricher.enrich(merged, context(), new ArrayList<>());

        assertThat(out).containsExactlyElementsOf(merged);
    }

    @Test
    @DisplayName("replace drops fields the snapshot does not carry when the overlay fails")
    void replaceDoesNotKeepReplacedFields() {
        List<MetricRecord> merged = List.of(interpolated(TODAY, 1_000_000, "3.1"));
        scripted.answer("beaconchain", c -> List.of(today("total_validators", 1_050_000, "beaconchain")))
                .fail("lido", new SourceUnavailableException("HTTP 502"));
        List<String> warnings = new ArrayList<>();

        List<MetricRecord> out = enricher.enrich(merged, context(), warnings);

        assertThat(out).singleElement().satisfies(r -> {
            assertThat(r.getSource()).isEqualTo("beaconchain");
            assertThat(r.value("total_validators")).isEqualTo(1_050_000L);
            assertThat(r.decimal("total_staked_eth")).isEqualByComparingTo("33600000");
            assertThat(r.value("avg_apr")).isNull();
        });
        assertThat(warnings).singleElement().asString().contains("lido");
    }
}
