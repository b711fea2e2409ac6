package com.ethval.catalog.metrics;

import com.ethval.catalog.Anchor;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.InterpolationTier;
import com.ethval.catalog.JsonRequest;
import com.ethval.catalog.KeyDefinition;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.MetricGroup;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.Regime;
import com.ethval.catalog.RegimeTier;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.SourceApi;
import com.ethval.catalog.ValidRange;
import com.ethval.catalog.ValueRange;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * TVL, fees and volume series, mostly from DefiLlama. The per-chain and per-protocol series have no
 * synthetic tier: a dimension without live data is reported as a partial result instead.
 */
@Component
@Order(2)
public class DefiMetrics implements MetricGroup {

    static final List<String> L2_CHAINS = List.of(
            "Arbitrum", "Optimism", "Base", "Polygon zkEVM", "zkSync Era",
            "Linea", "Scroll", "Blast", "Mantle", "Starknet");

    static final List<String> LST_PROTOCOLS = List.of(
            "lido", "rocket-pool", "coinbase-wrapped-staked-eth", "frax-ether", "stakewise");

    static final List<String> DEFI_PROTOCOLS = List.of(
            "aave-v3", "uniswap-v3", "makerdao", "eigenlayer", "curve-dex");

    @Override
    public List<MetricDefinition> definitions() {
        return List.of(
                ethereumTvl(),
                l2Tvl(),
                protocolFees(),
                dexVolume(),
                stablecoinSupply(),
                lstTvl(),
                defiProtocolTvl());
    }

    static MetricDefinition ethereumTvl() {
        return MetricDefinition.builder("ethereum_tvl")
                .schema(RecordSchema.of(tvl()))
                .tier(SourceTiers.defiLlamaChainTvl("Ethereum"))
                .tier(InterpolationTier.of(
                        Anchor.on("2022-01-01", Map.of("tvl", 150_000_000_000L)),
                        Anchor.on("2022-06-15", Map.of("tvl", 60_000_000_000L)),
                        Anchor.on("2023-01-01", Map.of("tvl", 25_000_000_000L)),
                        Anchor.on("2024-01-01", Map.of("tvl", 35_000_000_000L)),
                        Anchor.on("2024-06-01", Map.of("tvl", 60_000_000_000L)),
                        Anchor.on("2025-01-01", Map.of("tvl", 70_000_000_000L)),
                        Anchor.today(Map.of("tvl", 60_000_000_000L))))
                .build();
    }

    static MetricDefinition l2Tvl() {
        return MetricDefinition.builder("l2_tvl")
                .key(KeyDefinition.composite("chain", L2_CHAINS))
                .schema(RecordSchema.of(tvl()))
                .tier(SourceTiers.defiLlamaChainTvl("{dimension}"))
                .build();
    }

    static MetricDefinition protocolFees() {
        return MetricDefinition.builder("protocol_fees")
                .schema(RecordSchema.of(FieldSpec.decimal("fees", 2).asRequired().valid(ValidRange.nonNegative())))
                .tier(SourceTiers.defiLlamaDataChart("/summary/fees/ethereum?dataType=dailyFees", "fees"))
                .tier(RegimeTier.of(
                        Regime.initial(Map.of("fees", ValueRange.of(2_000_000, 15_000_000))),
                        Regime.from("2023-01-01", Map.of("fees", ValueRange.of(1_500_000, 8_000_000))),
                        Regime.from("2024-01-01", Map.of("fees", ValueRange.of(1_000_000, 10_000_000))),
                        Regime.from("2025-01-01", Map.of("fees", ValueRange.of(300_000, 3_000_000)))))
                .build();
    }

    static MetricDefinition dexVolume() {
        return MetricDefinition.builder("dex_volume")
                .schema(RecordSchema.of(FieldSpec.decimal("volume_usd", 2).asRequired().valid(ValidRange.nonNegative())))
                .tier(SourceTiers.defiLlamaDataChart(
                        "/overview/dexs/ethereum?excludeTotalDataChartBreakdown=true&dataType=dailyVolume",
                        "volume_usd"))
                .tier(RegimeTier.of(Regime.initial(Map.of("volume_usd", ValueRange.of(500_000_000, 3_000_000_000L)))))
                .build();
    }

    static MetricDefinition stablecoinSupply() {
        return MetricDefinition.builder("stablecoin_supply")
                .schema(RecordSchema.of(FieldSpec.decimal("total_supply_usd", 2).asRequired()
                        .valid(ValidRange.positive())))
                .tier(RestJsonTier.of(SourceTiers.DEFILLAMA, SourceApi.DEFILLAMA_STABLECOINS,
                        JsonRequest.get("{defillama_stablecoins}/stablecoincharts/Ethereum")
                                .date("/date")
                                .field("total_supply_usd", "/totalCirculatingUSD/peggedUSD")
                                .build()))
                .tier(InterpolationTier.of(
                        Anchor.on("2022-01-01", Map.of("total_supply_usd", 120_000_000_000L)),
                        Anchor.on("2022-05-01", Map.of("total_supply_usd", 150_000_000_000L)),
                        Anchor.on("2023-01-01", Map.of("total_supply_usd", 125_000_000_000L)),
                        Anchor.on("2024-01-01", Map.of("total_supply_usd", 110_000_000_000L)),
                        Anchor.on("2025-01-01", Map.of("total_supply_usd", 120_000_000_000L)),
                        Anchor.today(Map.of("total_supply_usd", 130_000_000_000L))))
                .build();
    }

    static MetricDefinition lstTvl() {
        return MetricDefinition.builder("lst_tvl")
                .key(KeyDefinition.composite("protocol", LST_PROTOCOLS))
                .schema(RecordSchema.of(tvl()))
                .tier(SourceTiers.defiLlamaProtocolTvl())
                .build();
    }

    static MetricDefinition defiProtocolTvl() {
        return MetricDefinition.builder("defi_protocol_tvl")
                .key(KeyDefinition.composite("protocol", DEFI_PROTOCOLS))
                .schema(RecordSchema.of(tvl()))
                .tier(SourceTiers.defiLlamaProtocolTvl())
                .build();
    }

    private static FieldSpec tvl() {
        return FieldSpec.decimal("tvl", 2).asRequired().valid(ValidRange.nonNegative());
    }
}
