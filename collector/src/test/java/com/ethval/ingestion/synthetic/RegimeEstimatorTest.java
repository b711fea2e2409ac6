package com.ethval.ingestion.synthetic;

import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.Regime;
import com.ethval.catalog.ValueRange;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RegimeEstimatorTest {

    private final RegimeEstimator estimator = new RegimeEstimator();

    private static final RecordSchema GAS = RecordSchema.of(
            FieldSpec.decimal("avg_gas_price_gwei", 2),
            FieldSpec.integer("transaction_count"),
            FieldSpec.decimal("eth_burned", 2));

    private static final List<Regime> REGIMES = List.of(
            Regime.initial(Map.of("avg_gas_price_gwei", ValueRange.of(70, 130),
                    "transaction_count", ValueRange.of(1_000_000, 1_300_000))),
            Regime.from("2022-09-15", Map.of("avg_gas_price_gwei", ValueRange.of(17.5, 32.5),
                    "transaction_count", ValueRange.of(1_000_000, 1_300_000))));

    @Test
    void everyDrawIsInsideTheBandOfItsRegime() {
        DateWindow window = new DateWindow(LocalDate.of(2022, 8, 1), LocalDate.of(2022, 10, 31));

        List<MetricRecord> records = estimator.estimate(REGIMES, GAS, window, new Random(42));

        assertThat(records).hasSize(window.days());
        for (MetricRecord r : records) {
            BigDecimal gas = r.decimal("avg_gas_price_gwei");
            if (r.getDate().isBefore(LocalDate.of(2022, 9, 15))) {
                assertThat(gas).isBetween(new BigDecimal("70"), new BigDecimal("130"));
            } else {
                assertThat(gas).isBetween(new BigDecimal("17.5"), new BigDecimal("32.5"));
            }
            assertThat(r.integer("transaction_count")).isBetween(1_000_000L, 1_300_000L);
            assertThat(r.has("eth_burned")).isFalse();
            assertThat(r.getSource()).isEqualTo("estimated");
        }
    }

    @Test
    void regimeFor_picksLatestStartOnOrBeforeDay() {
        assertThat(RegimeEstimator.regimeFor(REGIMES, LocalDate.of(2022, 9, 14))).isSameAs(REGIMES.get(0));
        assertThat(RegimeEstimator.regimeFor(REGIMES, LocalDate.of(2022, 9, 15))).isSameAs(REGIMES.get(1));
    }

    @Test
    void noRegimeInForceProducesNoRecord() {
        List<Regime> late = List.of(Regime.from("2024-01-01", Map.of("avg_gas_price_gwei", ValueRange.of(1, 2))));
        DateWindow window = new DateWindow(LocalDate.of(2023, 12, 30), LocalDate.of(2024, 1, 2));

        assertThat(estimator.estimate(late, GAS, window, new Random(1))).hasSize(2);
    }
}
