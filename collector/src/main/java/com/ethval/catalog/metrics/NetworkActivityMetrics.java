package com.ethval.catalog.metrics;

import com.ethval.catalog.CsvTier;
import com.ethval.catalog.EnrichmentSpec;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.JsonRequest;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.MetricGroup;
import com.ethval.catalog.Pagination;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.Regime;
import com.ethval.catalog.RegimeTier;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.SourceApi;
import com.ethval.catalog.UnitHint;
import com.ethval.catalog.ValidRange;
import com.ethval.catalog.ValueRange;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * On-chain activity series from Etherscan: daily stats API (needs a key), then the public chart CSV
 * export, then a regime estimate.
 */
@Component
@Order(4)
public class NetworkActivityMetrics implements MetricGroup {

    @Override
    public List<MetricDefinition> definitions() {
        return List.of(
                gasBurn(),
                activeAddresses(),
                etherscanSeries("transaction_count", FieldSpec.integer("tx_count"),
                        "dailytx", "/transactionCount", "tx",
                        RegimeTier.of(
                                Regime.initial(Map.of("tx_count", ValueRange.of(900_000, 1_300_000))),
                                Regime.from("2025-01-01", Map.of("tx_count", ValueRange.of(1_100_000, 1_700_000))))),
                etherscanSeries("avg_block_time", FieldSpec.decimal("block_time_sec", 2),
                        "dailyavgblocktime", "/blockTime_sec", "blocktime",
                        RegimeTier.of(Regime.initial(Map.of("block_time_sec", ValueRange.of(11.9, 12.3))))),
                etherscanSeries("block_count", FieldSpec.integer("block_count"),
                        "dailyblkcount", "/blockCount", "blocks",
                        RegimeTier.of(Regime.initial(Map.of("block_count", ValueRange.of(7_000, 7_200))))),
                etherscanSeries("network_utilization",
                        FieldSpec.decimal("network_utilization", 4).unit(UnitHint.PERCENT_TO_FRACTION),
                        "dailynetutilization", "/networkUtilization", "networkutilization",
                        RegimeTier.of(Regime.initial(Map.of("network_utilization", ValueRange.of(0.45, 0.6))))),
                etherscanSeries("avg_gas_limit", FieldSpec.integer("gas_limit"),
                        "dailyavggaslimit", "/gasLimit", "gaslimit",
                        RegimeTier.of(
                                Regime.initial(Map.of("gas_limit", ValueRange.of(29_900_000, 30_100_000))),
                                Regime.from("2025-02-05", Map.of("gas_limit", ValueRange.of(35_900_000, 36_100_000))))),
                etherscanSeries("total_gas_used", FieldSpec.integer("gas_used"),
                        "dailygasused", "/gasUsed", "gasused",
                        RegimeTier.of(Regime.initial(Map.of("gas_used", ValueRange.of(100_000_000_000L, 120_000_000_000L))))),
                etherscanSeries("network_tx_fee", FieldSpec.decimal("tx_fee_eth", 8).unit(UnitHint.WEI_TO_ETH),
                        "dailytxnfee", "/transactionFee_Eth", "transactionfee",
                        RegimeTier.of(
                                Regime.initial(Map.of("tx_fee_eth", ValueRange.of(1_500, 5_000))),
                                Regime.from("2024-03-13", Map.of("tx_fee_eth", ValueRange.of(300, 2_000))),
                                Regime.from("2025-01-01", Map.of("tx_fee_eth", ValueRange.of(100, 800))))),
                etherscanSeries("block_rewards", FieldSpec.decimal("block_rewards_eth", 8).unit(UnitHint.WEI_TO_ETH),
                        "dailyblockrewards", "/blockRewards_Eth", "blockreward",
                        RegimeTier.of(
                                Regime.initial(Map.of("block_rewards_eth", ValueRange.of(300, 2_000))),
                                Regime.from("2025-01-01", Map.of("block_rewards_eth", ValueRange.of(100, 700))))),
                ethBurnedDaily());
    }

    /**
     * Gas price arrives in Wei from both the API and the chart export; {@link UnitHint#WEI_TO_GWEI}
     * brings anything above 1,000,000 to Gwei. Today's record also carries the all-time burn total
     * from ultrasound.money.
     */
    static MetricDefinition gasBurn() {
        return MetricDefinition.builder("gas_burn")
                .schema(RecordSchema.of(
                        FieldSpec.decimal("avg_gas_price_gwei", 9).unit(UnitHint.WEI_TO_GWEI)
                                .valid(ValidRange.exclusive("0", "1000")),
                        FieldSpec.integer("total_gas_used").valid(ValidRange.nonNegative()),
                        FieldSpec.integer("transaction_count").valid(ValidRange.nonNegative()),
                        FieldSpec.decimal("eth_burned", 8).unit(UnitHint.WEI_TO_ETH),
                        FieldSpec.decimal("eth_burned_total", 8).unit(UnitHint.WEI_TO_ETH)))
                .tier(RestJsonTier.paged(SourceTiers.ETHERSCAN, SourceApi.ETHERSCAN, Pagination.dateChunks(365),
                        SourceTiers.etherscanDaily("dailyavggasprice", "avg_gas_price_gwei", "/avgGasPrice_Wei"),
                        SourceTiers.etherscanDaily("dailytx", "transaction_count", "/transactionCount"),
                        SourceTiers.etherscanDaily("dailygasused", "total_gas_used", "/gasUsed")))
                .tier(CsvTier.etherscanChart("gasprice", "avg_gas_price_gwei"))
                .tier(RegimeTier.of(
                        Regime.initial(gasBand(100)),
                        Regime.from("2021-08-05", gasBand(40)),
                        Regime.from("2022-09-15", gasBand(25)),
                        Regime.from("2024-03-13", gasBand(15))))
                .enrich(EnrichmentSpec.overlay(RestJsonTier.of("ultrasound", SourceApi.ULTRASOUND,
                        JsonRequest.get("{ultrasound}/api/v2/fees/eth-burned-all-time")
                                .field("eth_burned_total", "/ethBurned")
                                .build())))
                .build();
    }

    /**
     * Etherscan's API only has new addresses, its chart export only active addresses; whichever wins a
     * day leaves the other field empty.
     */
    static MetricDefinition activeAddresses() {
        return MetricDefinition.builder("active_addresses")
                .schema(RecordSchema.of(
                        FieldSpec.integer("active_addresses").valid(ValidRange.nonNegative()),
                        FieldSpec.integer("new_addresses").valid(ValidRange.nonNegative())))
                .tier(SourceTiers.etherscanDailyTier("dailynewaddress", "new_addresses", "/newAddressCount"))
                .tier(CsvTier.etherscanChart("active-address", "active_addresses"))
                .tier(RegimeTier.of(
                        Regime.initial(addressBand(400_000, 40_000)),
                        Regime.from("2021-01-01", addressBand(550_000, 80_000)),
                        Regime.from("2022-01-01", addressBand(380_000, 35_000)),
                        Regime.from("2023-01-01", addressBand(420_000, 45_000)),
                        Regime.from("2024-01-01", addressBand(480_000, 55_000))))
                .build();
    }

    static MetricDefinition ethBurnedDaily() {
        return MetricDefinition.builder("eth_burned_daily")
                .schema(RecordSchema.of(FieldSpec.decimal("eth_burned", 8).asRequired().unit(UnitHint.WEI_TO_ETH)
                        .valid(ValidRange.nonNegative())))
                .tier(CsvTier.etherscanChart("dailyethburnt", "eth_burned"))
                .tier(RegimeTier.of(
                        Regime.initial(Map.of("eth_burned", ValueRange.of(1_500, 4_000))),
                        Regime.from("2024-03-13", Map.of("eth_burned", ValueRange.of(100, 1_500))),
                        Regime.from("2025-01-01", Map.of("eth_burned", ValueRange.of(50, 600)))))
                .build();
    }

    private static MetricDefinition etherscanSeries(String name, FieldSpec field, String action, String pointer,
                                                    String chart, RegimeTier estimate) {
        FieldSpec required = field.asRequired().valid(ValidRange.nonNegative());
        return MetricDefinition.builder(name)
                .schema(RecordSchema.of(required))
                .tier(SourceTiers.etherscanDailyTier(action, field.name(), pointer))
                .tier(CsvTier.etherscanChart(chart, field.name()))
                .tier(estimate)
                .build();
    }

    /** Base gas price scaled by 0.3-0.7, one million to 1.3 million transactions. */
    private static Map<String, ValueRange> gasBand(int baseGwei) {
        return Map.of(
                "avg_gas_price_gwei", ValueRange.of(
                        BigDecimal.valueOf(baseGwei).multiply(new BigDecimal("0.3")),
                        BigDecimal.valueOf(baseGwei).multiply(new BigDecimal("0.7"))),
                "transaction_count", ValueRange.of(1_000_000, 1_300_000));
    }

    /** Typical active/new address counts, +/-15%. */
    private static Map<String, ValueRange> addressBand(int active, int fresh) {
        return Map.of(
                "active_addresses", ValueRange.of(Math.round(active * 0.85), Math.round(active * 1.15)),
                "new_addresses", ValueRange.of(Math.round(fresh * 0.85), Math.round(fresh * 1.15)));
    }
}
