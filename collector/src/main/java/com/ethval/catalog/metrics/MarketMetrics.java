package com.ethval.catalog.metrics;

import com.ethval.catalog.DerivedTier;
import com.ethval.catalog.FieldDerivation;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.JsonRequest;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.MetricGroup;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.Regime;
import com.ethval.catalog.RegimeTier;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.SourceApi;
import com.ethval.catalog.ValidRange;
import com.ethval.catalog.ValueRange;
import com.ethval.domain.MetricRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Price, market and sentiment series. eth_price comes first: eth_volatility reads it from the store.
 */
@Component
@Order(1)
public class MarketMetrics implements MetricGroup {

    @Override
    public List<MetricDefinition> definitions() {
        return List.of(
                ethPrice(),
                ethBtcRatio(),
                ethDominance(),
                ethVolatility(),
                ethMarketCap(),
                ethTradingVolume(),
                fearGreed());
    }

    static MetricDefinition ethPrice() {
        return MetricDefinition.builder("eth_price")
                .schema(RecordSchema.of(
                        FieldSpec.decimal("open", 2),
                        FieldSpec.decimal("high", 2),
                        FieldSpec.decimal("low", 2),
                        FieldSpec.decimal("close", 2).asRequired().valid(ValidRange.positive()),
                        FieldSpec.decimal("volume", 2)))
                .tier(SourceTiers.cryptoCompareHistoday("ETH", "USD", Map.of(
                        "open", "/open",
                        "high", "/high",
                        "low", "/low",
                        "close", "/close",
                        "volume", "/volumeto")))
                .tier(RestJsonTier.of(SourceTiers.COINGECKO, SourceApi.COINGECKO,
                        JsonRequest.get("{coingecko}/coins/ethereum/market_chart?vs_currency=usd&days=365&interval=daily")
                                .rows("/prices").date("/0").field("close", "/1").build(),
                        JsonRequest.get("{coingecko}/coins/ethereum/market_chart?vs_currency=usd&days=365&interval=daily")
                                .rows("/total_volumes").date("/0").field("volume", "/1").build()))
                .tier(RegimeTier.of(
                        Regime.initial(Map.of("close", ValueRange.of(1000, 4800))),
                        Regime.from("2022-06-01", Map.of("close", ValueRange.of(900, 2000))),
                        Regime.from("2023-01-01", Map.of("close", ValueRange.of(1200, 2400))),
                        Regime.from("2024-01-01", Map.of("close", ValueRange.of(2100, 4000))),
                        Regime.from("2025-01-01", Map.of("close", ValueRange.of(1500, 4800)))))
                .build();
    }

    static MetricDefinition ethBtcRatio() {
        return MetricDefinition.builder("eth_btc_ratio")
                .schema(RecordSchema.of(FieldSpec.decimal("ratio", 6).asRequired().valid(ValidRange.positive())))
                .tier(SourceTiers.cryptoCompareHistoday("ETH", "BTC", Map.of("ratio", "/close")))
                .tier(RegimeTier.of(
                        Regime.initial(Map.of("ratio", ValueRange.of(0.06, 0.08))),
                        Regime.from("2023-01-01", Map.of("ratio", ValueRange.of(0.055, 0.075))),
                        Regime.from("2024-01-01", Map.of("ratio", ValueRange.of(0.035, 0.06))),
                        Regime.from("2025-01-01", Map.of("ratio", ValueRange.of(0.018, 0.04)))))
                .build();
    }

    /**
     * CoinGecko only publishes the current dominance, so any non-empty answer is enough.
     */
    static MetricDefinition ethDominance() {
        return MetricDefinition.builder("eth_dominance")
                .snapshot()
                .schema(RecordSchema.of(FieldSpec.decimal("dominance_pct", 2).asRequired()
                        .valid(ValidRange.between("0", "100"))))
                .tier(RestJsonTier.of(SourceTiers.COINGECKO, SourceApi.COINGECKO,
                        JsonRequest.get("{coingecko}/global")
                                .rows("/data")
                                .field("dominance_pct", "/market_cap_percentage/eth")
                                .build()))
                .tier(RegimeTier.of(
                        Regime.initial(Map.of("dominance_pct", ValueRange.of(16, 20))),
                        Regime.from("2024-01-01", Map.of("dominance_pct", ValueRange.of(14, 18))),
                        Regime.from("2025-01-01", Map.of("dominance_pct", ValueRange.of(8, 14)))))
                .build();
    }

    static MetricDefinition ethVolatility() {
        return MetricDefinition.builder("eth_volatility")
                .schema(RecordSchema.of(FieldSpec.decimal("volatility_30d", 4).asRequired()
                        .valid(ValidRange.nonNegative())))
                .tier(new DerivedTier("historical_eth_price", "close", 30, "volatility_30d"))
                .tier(RegimeTier.of(Regime.initial(Map.of("volatility_30d", ValueRange.of(30, 90)))))
                .build();
    }

    static MetricDefinition ethMarketCap() {
        return MetricDefinition.builder("eth_market_cap")
                .schema(RecordSchema.of(FieldSpec.decimal("market_cap", 2).asRequired().valid(ValidRange.positive())))
                .tier(SourceTiers.coinGeckoMarketChart("/market_caps", "market_cap"))
                .tier(RegimeTier.of(
                        Regime.initial(Map.of("market_cap", ValueRange.of(150_000_000_000L, 300_000_000_000L))),
                        Regime.from("2024-01-01", Map.of("market_cap", ValueRange.of(250_000_000_000L, 480_000_000_000L)))))
                .build();
    }

    static MetricDefinition ethTradingVolume() {
        return MetricDefinition.builder("eth_trading_volume")
                .schema(RecordSchema.of(FieldSpec.decimal("volume_usd", 2).asRequired().valid(ValidRange.nonNegative())))
                .tier(SourceTiers.cryptoCompareHistoday("ETH", "USD", Map.of("volume_usd", "/volumeto")))
                .tier(SourceTiers.coinGeckoMarketChart("/total_volumes", "volume_usd"))
                .tier(RegimeTier.of(Regime.initial(Map.of("volume_usd", ValueRange.of(5_000_000_000L, 40_000_000_000L)))))
                .build();
    }

    static MetricDefinition fearGreed() {
        return MetricDefinition.builder("fear_greed")
                .schema(RecordSchema.of(
                        FieldSpec.integer("value").asRequired().valid(ValidRange.between("0", "100")),
                        FieldSpec.text("classification")))
                .tier(RestJsonTier.of("alternative_me", SourceApi.ALTERNATIVE_ME,
                        JsonRequest.get("{alternative_me}/fng/?limit={days}&format=json")
                                .rows("/data")
                                .date("/timestamp")
                                .timestamp("/timestamp")
                                .field("value", "/value")
                                .field("classification", "/value_classification")
                                .build()))
                .tier(RegimeTier.of(Regime.initial(Map.of("value", ValueRange.of(20, 80)))))
                .derive(new FieldDerivation("classification", MarketMetrics::classifyFearGreed))
                .build();
    }

    /**
     * alternative.me bands: 0-24 extreme fear, 25-44 fear, 45-55 neutral, 56-74 greed, 75-100 extreme greed.
     */
    static String classifyFearGreed(MetricRecord record) {
        Long value = record.integer("value");
        if (value == null) {
            return null;
        }
        if (value <= 24) {
            return "Extreme Fear";
        }
        if (value <= 44) {
            return "Fear";
        }
        if (value <= 55) {
            return "Neutral";
        }
        if (value <= 74) {
            return "Greed";
        }
        return "Extreme Greed";
    }
}
