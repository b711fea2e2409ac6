package com.ethval.ingestion.normalizer;

import com.ethval.catalog.FieldDerivation;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.RegimeTier;
import com.ethval.catalog.Regime;
import com.ethval.catalog.UnitHint;
import com.ethval.catalog.ValidRange;
import com.ethval.catalog.ValueRange;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.adapter.RawRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordNormalizerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer();

    private static final MetricDefinition GAS = MetricDefinition.builder("gas_burn")
            .schema(RecordSchema.of(
                    FieldSpec.decimal("avg_gas_price_gwei", 9).unit(UnitHint.WEI_TO_GWEI)
                            .valid(ValidRange.exclusive("0", "1000")),
                    FieldSpec.integer("transaction_count").valid(ValidRange.nonNegative()),
                    FieldSpec.decimal("eth_burned", 2)))
            .tier(RegimeTier.of(Regime.initial(Map.of("eth_burned", ValueRange.of(1, 2)))))
            .build();

    private static final MetricDefinition PRICE = MetricDefinition.builder("eth_price")
            .schema(RecordSchema.of(FieldSpec.decimal("close", 2).asRequired().valid(ValidRange.positive())))
            .tier(RegimeTier.of(Regime.initial(Map.of("close", ValueRange.of(1000, 2000)))))
            .build();

    @Test
    @DisplayName("Wei gas price 25000000000 becomes 25.0 Gwei")
    void weiToGwei() {
        MetricRecord record = normalizer.normalize(
                new RawRow("2024-03-09", null, Map.of("avg_gas_price_gwei", "25000000000"), "etherscan"), GAS, null);

        assertThat(record.decimal("avg_gas_price_gwei")).isEqualByComparingTo("25.0");
        assertThat(record.getDate()).isEqualTo(LocalDate.of(2024, 3, 9));
        assertThat(record.getTimestamp()).isEqualTo(1709942400L);
        assertThat(record.getSource()).isEqualTo("etherscan");
    }

    @Test
    void gweiValuePassesThrough() {
        MetricRecord record = normalizer.normalize(
                new RawRow("3/9/2024", null, Map.of("avg_gas_price_gwei", "31.5"), "etherscan_csv"), GAS, null);
        assertThat(record.decimal("avg_gas_price_gwei")).isEqualByComparingTo("31.5");
    }

    @Test
    @DisplayName("values are rounded HALF_UP to the field scale and integers become Long")
    void roundingAndTyping() {
        Map<String, Object> values = new HashMap<>();
        values.put("eth_burned", new BigDecimal("1234.565"));
        values.put("transaction_count", "1,234,567");
        MetricRecord record = normalizer.normalize(new RawRow(null, "1709942400", values, "etherscan"), GAS, null);

        assertThat(record.decimal("eth_burned")).isEqualByComparingTo("1234.57");
        assertThat(record.value("transaction_count")).isEqualTo(1_234_567L);
        assertThat(record.getDate()).isEqualTo(LocalDate.of(2024, 3, 9));
    }

    @Test
    @DisplayName("out-of-range and placeholder values become null")
    void outOfRangeBecomesNull() {
        Map<String, Object> values = new HashMap<>();
        values.put("avg_gas_price_gwei", "0");
        values.put("eth_burned", "-");
        MetricRecord record = normalizer.normalize(new RawRow("2024-03-09", null, values, "etherscan"), GAS, null);

        assertThat(record.has("avg_gas_price_gwei")).isFalse();
        assertThat(record.has("eth_burned")).isFalse();
        assertThat(record.getValues()).containsKey("avg_gas_price_gwei");
    }

    @Test
    void missingRequiredFieldIsRejected() {
        RawRow row = new RawRow("2024-03-09", null, Map.of("close", "-5"), "cryptocompare");
        assertThatThrownBy(() -> normalizer.normalize(row, PRICE, null))
                .isInstanceOf(NormalizationException.class)
                .hasMessageContaining("close");
    }

    @Test
    void normalizeAll_dropsAndCountsBadRows() {
        List<RawRow> rows = List.of(
                new RawRow("2024-03-08", null, Map.of("close", "3900.123"), "cryptocompare"),
                new RawRow("not a date", null, Map.of("close", "3910"), "cryptocompare"),
                new RawRow("2024-03-09", null, Map.of("close", "abc"), "cryptocompare"),
                new RawRow("2024-03-10", null, Map.of(), "cryptocompare"));

        NormalizedRows result = normalizer.normalizeAll(rows, PRICE, null);

        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0).decimal("close")).isEqualByComparingTo("3900.12");
        assertThat(result.dropped()).isEqualTo(3);
    }

    @Test
    @DisplayName("derivations fill empty fields only")
    void derivationsFillNullFields() {
        MetricDefinition staking = MetricDefinition.builder("staking")
                .schema(RecordSchema.of(FieldSpec.decimal("total_staked_eth", 2), FieldSpec.integer("total_validators")))
                .tier(RegimeTier.of(Regime.initial(Map.of("total_validators", ValueRange.of(1, 2)))))
                .derive(new FieldDerivation("total_staked_eth",
                        r -> r.has("total_validators") ? r.integer("total_validators") * 32 : null))
                .build();

        MetricRecord derived = normalizer.normalize(
                new RawRow("2024-03-09", null, Map.of("total_validators", 1_000_000), "beaconchain"), staking, null);
        MetricRecord explicit = normalizer.normalize(
                new RawRow("2024-03-09", null, Map.of("total_validators", 10, "total_staked_eth", "5"), "beaconchain"),
                staking, null);

        assertThat(derived.decimal("total_staked_eth")).isEqualByComparingTo("32000000");
        assertThat(explicit.decimal("total_staked_eth")).isEqualByComparingTo("5");
    }
}
