package com.ethval.ingestion.synthetic;

import com.ethval.catalog.Anchor;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.RecordSchema;
import com.ethval.domain.MetricRecord;
import com.ethval.domain.SourceTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InterpolatorTest {

    private final Interpolator interpolator = new Interpolator();

    private static final RecordSchema STAKING = RecordSchema.of(
            FieldSpec.decimal("total_staked_eth", 2),
            FieldSpec.integer("total_validators"));

    private static final LocalDate TODAY = LocalDate.of(2021, 7, 1);

    private final List<Anchor> anchors = List.of(
            Anchor.on("2020-12-01", Map.of("total_staked_eth", 524_288, "total_validators", 16_384)),
            Anchor.on("2021-06-01", Map.of("total_staked_eth", 5_000_000, "total_validators", 156_250)),
            Anchor.today(Map.of("total_staked_eth", 5_100_000, "total_validators", 159_375)));

    @Test
    @DisplayName("anchor values are reproduced exactly on anchor days")
    void anchorDaysKeepExactValues() {
        List<MetricRecord> records = interpolator.interpolate(anchors, STAKING, TODAY);

        assertThat(records.get(0).getDate()).isEqualTo(LocalDate.of(2020, 12, 1));
        assertThat(records.get(0).decimal("total_staked_eth")).isEqualByComparingTo("524288");
        MetricRecord june = records.stream().filter(r -> r.getDate().equals(LocalDate.of(2021, 6, 1))).findFirst().orElseThrow();
        assertThat(june.decimal("total_staked_eth")).isEqualByComparingTo("5000000");
        assertThat(june.value("total_validators")).isEqualTo(156_250L);
        MetricRecord last = records.get(records.size() - 1);
        assertThat(last.getDate()).isEqualTo(TODAY);
        assertThat(last.decimal("total_staked_eth")).isEqualByComparingTo("5100000");
    }

    @Test
    @DisplayName("one record per day, interior anchor not duplicated, nothing past today")
    void onePerDay() {
        List<MetricRecord> records = interpolator.interpolate(anchors, STAKING, TODAY);

        assertThat(records).hasSize(213);
        assertThat(records).extracting(MetricRecord::getDate).doesNotHaveDuplicates();
        assertThat(records.stream().filter(r -> r.getDate().equals(LocalDate.of(2021, 6, 1)))).hasSize(1);
        assertThat(records).allMatch(r -> !r.getDate().isAfter(TODAY));
        assertThat(records).allMatch(r -> SourceTag.INTERPOLATED.equals(r.getSource()));
        assertThat(records).allMatch(r -> r.getTimestamp() != null);
    }

    @Test
    @DisplayName("interpolated values stay within the bracketing anchors and increase monotonically")
    void valuesStayWithinBounds() {
        List<MetricRecord> records = interpolator.interpolate(anchors, STAKING, TODAY);

        BigDecimal previous = BigDecimal.ZERO;
        for (MetricRecord r : records) {
            BigDecimal v = r.decimal("total_staked_eth");
            assertThat(v).isBetween(new BigDecimal("524288"), new BigDecimal("5100000"));
            assertThat(v).isGreaterThanOrEqualTo(previous);
            assertThat(v.scale()).isEqualTo(2);
            assertThat(r.value("total_validators")).isInstanceOf(Long.class);
            previous = v;
        }
    }

    @Test
    void midpointIsLinear() {
        List<Anchor> two = List.of(
                Anchor.on("2024-01-01", Map.of("total_staked_eth", 100, "total_validators", 10)),
                Anchor.on("2024-01-11", Map.of("total_staked_eth", 200, "total_validators", 20)));

        List<MetricRecord> records = interpolator.interpolate(two, STAKING, LocalDate.of(2024, 1, 11));

        assertThat(records).hasSize(11);
        assertThat(records.get(5).decimal("total_staked_eth")).isEqualByComparingTo("150");
        assertThat(records.get(5).value("total_validators")).isEqualTo(15L);
    }

    @Test
    @DisplayName("a degenerate interval (d1 <= d0) contributes nothing")
    void degenerateIntervalSkipped() {
        List<Anchor> degenerate = List.of(
                Anchor.on("2024-01-05", Map.of("total_staked_eth", 100, "total_validators", 1)),
                Anchor.on("2024-01-05", Map.of("total_staked_eth", 900, "total_validators", 9)),
                Anchor.on("2024-01-07", Map.of("total_staked_eth", 300, "total_validators", 3)));

        List<MetricRecord> records = interpolator.interpolate(degenerate, STAKING, LocalDate.of(2024, 1, 7));

        assertThat(records).extracting(MetricRecord::getDate)
                .containsExactly(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 6), LocalDate.of(2024, 1, 7));
        assertThat(records.get(0).decimal("total_staked_eth")).isEqualByComparingTo("900");
        assertThat(records.get(1).decimal("total_staked_eth")).isEqualByComparingTo("600");
    }

    @Test
    void fieldMissingFromAnAnchorIsNull() {
        List<Anchor> partial = List.of(
                Anchor.on("2024-01-01", Map.of("total_staked_eth", 100)),
                Anchor.on("2024-01-03", Map.of("total_staked_eth", 300, "total_validators", 3)));

        List<MetricRecord> records = interpolator.interpolate(partial, STAKING, LocalDate.of(2024, 1, 3));

        assertThat(records.get(0).has("total_validators")).isFalse();
        assertThat(records.get(2).value("total_validators")).isEqualTo(3L);
    }
}
