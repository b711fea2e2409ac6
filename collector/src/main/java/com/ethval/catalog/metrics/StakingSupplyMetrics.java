package com.ethval.catalog.metrics;

import com.ethval.catalog.Anchor;
import com.ethval.catalog.EnrichmentSpec;
import com.ethval.catalog.FieldDerivation;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.InterpolationTier;
import com.ethval.catalog.JsonRequest;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.MetricGroup;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.Regime;
import com.ethval.catalog.RegimeTier;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.SourceApi;
import com.ethval.catalog.UnitHint;
import com.ethval.catalog.ValidRange;
import com.ethval.catalog.ValueRange;
import com.ethval.domain.MetricRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Staking and supply series. No free source offers their history, so they are interpolated between
 * milestones and today's record is refreshed from live snapshot endpoints.
 */
@Component
@Order(3)
public class StakingSupplyMetrics implements MetricGroup {

    static final BigDecimal ETH_PER_VALIDATOR = BigDecimal.valueOf(32);

    /** Lido stETH pool on DefiLlama yields. */
    static final String LIDO_STETH_POOL = "747c1d2a-c668-4682-b9f9-296708a3dd90";

    @Override
    public List<MetricDefinition> definitions() {
        return List.of(stakingData(), stakingApr(), ethSupply());
    }

    static MetricDefinition stakingData() {
        return MetricDefinition.builder("staking_data")
                .collection("historical_staking")
                .schema(RecordSchema.of(
                        FieldSpec.decimal("total_staked_eth", 2).valid(ValidRange.nonNegative()),
                        FieldSpec.integer("total_validators").valid(ValidRange.nonNegative()),
                        FieldSpec.decimal("avg_apr", 4).valid(ValidRange.between("0", "100"))))
                .tier(InterpolationTier.of(
                        staking("2020-12-01", 524_288, 16_384, "5.0"),
                        staking("2021-06-01", 5_000_000, 156_250, "4.7778"),
                        staking("2022-01-01", 9_000_000, 281_250, "4.5556"),
                        staking("2022-09-15", 14_000_000, 437_500, "4.3333"),
                        staking("2023-04-12", 18_000_000, 562_500, "4.1111"),
                        staking("2023-12-01", 28_000_000, 875_000, "3.8889"),
                        staking("2024-06-01", 32_000_000, 1_000_000, "3.6667"),
                        staking("2024-12-01", 34_000_000, 1_062_500, "3.4444"),
                        Anchor.today(Map.of(
                                "total_staked_eth", 34_800_000,
                                "total_validators", 1_087_500,
                                "avg_apr", new BigDecimal("3.0")))))
                .enrich(EnrichmentSpec.replace(RestJsonTier.of("beaconchain", SourceApi.BEACONCHAIN,
                        JsonRequest.get("{beaconchain}/api/v1/epoch/latest")
                                .rows("/data")
                                .field("total_validators", "/validatorscount")
                                .build())))
                .enrich(EnrichmentSpec.overlay(SourceTiers.lidoSmaApr("avg_apr")))
                .derive(new FieldDerivation("total_staked_eth", StakingSupplyMetrics::stakedFromValidators))
                .build();
    }

    static MetricDefinition stakingApr() {
        return MetricDefinition.builder("staking_apr")
                .schema(RecordSchema.of(FieldSpec.decimal("apr_pct", 4).asRequired()
                        .valid(ValidRange.between("0", "100"))))
                .tier(RestJsonTier.of(SourceTiers.DEFILLAMA, SourceApi.DEFILLAMA_YIELDS,
                        JsonRequest.get("{defillama_yields}/chart/" + LIDO_STETH_POOL)
                                .rows("/data")
                                .date("/timestamp")
                                .field("apr_pct", "/apy")
                                .build()))
                .tier(RegimeTier.of(
                        Regime.initial(Map.of("apr_pct", ValueRange.of(3.5, 5.5))),
                        Regime.from("2023-04-12", Map.of("apr_pct", ValueRange.of(3.2, 4.5))),
                        Regime.from("2024-01-01", Map.of("apr_pct", ValueRange.of(2.8, 3.8))),
                        Regime.from("2025-01-01", Map.of("apr_pct", ValueRange.of(2.5, 3.3)))))
                .enrich(EnrichmentSpec.overlay(SourceTiers.lidoSmaApr("apr_pct")))
                .build();
    }

    /**
     * Etherscan's ethsupply2 reports Wei; the hint brings it to ETH. The interpolated history has no
     * timestamp column.
     */
    static MetricDefinition ethSupply() {
        return MetricDefinition.builder("eth_supply")
                .schema(RecordSchema.of(
                        ethAmount("eth_supply"),
                        ethAmount("eth2_staking"),
                        ethAmount("burnt_fees"),
                        ethAmount("withdrawn_total")).withoutTimestamp())
                .tier(InterpolationTier.of(
                        supply("2021-01-01", 114_000_000, 2_100_000, 0),
                        supply("2021-08-05", 117_000_000, 6_900_000, 0),
                        supply("2022-01-01", 118_900_000, 9_000_000, 1_200_000),
                        supply("2022-09-15", 120_500_000, 14_000_000, 2_600_000),
                        supply("2023-01-01", 120_400_000, 16_000_000, 2_900_000),
                        supply("2023-04-12", 120_200_000, 18_000_000, 3_100_000),
                        supply("2024-01-01", 120_100_000, 29_000_000, 4_000_000),
                        supply("2024-06-01", 120_200_000, 32_000_000, 4_300_000),
                        supply("2024-12-01", 120_350_000, 34_000_000, 4_450_000),
                        Anchor.today(Map.of(
                                "eth_supply", 120_400_000,
                                "eth2_staking", 34_800_000,
                                "burnt_fees", 4_500_000))))
                .enrich(EnrichmentSpec.replace(RestJsonTier.of(SourceTiers.ETHERSCAN, SourceApi.ETHERSCAN,
                        JsonRequest.get("{etherscan}?module=stats&action=ethsupply2&apikey={etherscanKey}")
                                .rows("/result")
                                .field("eth_supply", "/EthSupply")
                                .field("eth2_staking", "/Eth2Staking")
                                .field("burnt_fees", "/BurntFees")
                                .field("withdrawn_total", "/WithdrawnTotal")
                                .expect("/status", "1")
                                .build())))
                .build();
    }

    static Object stakedFromValidators(MetricRecord record) {
        Long validators = record.integer("total_validators");
        return validators == null ? null : ETH_PER_VALIDATOR.multiply(BigDecimal.valueOf(validators));
    }

    private static Anchor staking(String date, long staked, long validators, String apr) {
        return Anchor.on(date, Map.of(
                "total_staked_eth", staked,
                "total_validators", validators,
                "avg_apr", new BigDecimal(apr)));
    }

    private static Anchor supply(String date, long supply, long staked, long burnt) {
        return Anchor.on(date, Map.of(
                "eth_supply", supply,
                "eth2_staking", staked,
                "burnt_fees", burnt));
    }

    private static FieldSpec ethAmount(String name) {
        return FieldSpec.decimal(name, 2).unit(UnitHint.WEI_TO_ETH).valid(ValidRange.nonNegative());
    }
}
