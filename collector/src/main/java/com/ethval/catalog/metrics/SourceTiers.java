package com.ethval.catalog.metrics;

import com.ethval.catalog.JsonRequest;
import com.ethval.catalog.Pagination;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.SourceApi;

import java.util.Map;

/**
 * Tier shapes shared by several metrics. URL placeholders are filled by the REST-JSON adapter.
 */
public final class SourceTiers {

    public static final String CRYPTOCOMPARE = "cryptocompare";
    public static final String COINGECKO = "coingecko";
    public static final String DEFILLAMA = "defillama";
    public static final String ETHERSCAN = "etherscan";

    private static final int CRYPTOCOMPARE_PAGE_SIZE = 2000;
    private static final int ETHERSCAN_CHUNK_DAYS = 365;

    private SourceTiers() {
    }

    /**
     * CryptoCompare daily OHLCV, paged backward with {@code toTs}.
     *
     * @param fieldPointers record field to histoday attribute, e.g. {@code close -> /close}
     */
    public static RestJsonTier cryptoCompareHistoday(String fsym, String tsym, Map<String, String> fieldPointers) {
        JsonRequest.Builder request = JsonRequest.get("{cryptocompare}/data/v2/histoday?fsym=" + fsym + "&tsym=" + tsym
                        + "&limit={limit}&toTs={toTs}&api_key={cryptocompareKey}")
                .rows("/Data/Data")
                .date("/time")
                .timestamp("/time")
                .expect("/Response", "Success");
        fieldPointers.forEach(request::field);
        return RestJsonTier.paged(CRYPTOCOMPARE, SourceApi.CRYPTOCOMPARE,
                Pagination.endTimestampCursor(CRYPTOCOMPARE_PAGE_SIZE), request.build());
    }

    /**
     * One series of CoinGecko's {@code market_chart}: {@code [[ms, value], ...]}. The free API serves 365 days.
     */
    public static RestJsonTier coinGeckoMarketChart(String seriesPointer, String field) {
        return RestJsonTier.of(COINGECKO, SourceApi.COINGECKO,
                JsonRequest.get("{coingecko}/coins/ethereum/market_chart?vs_currency=usd&days=365&interval=daily")
                        .rows(seriesPointer)
                        .date("/0")
                        .field(field, "/1")
                        .build());
    }

    /**
     * Etherscan daily statistics, requested in 365-day ranges. Needs an API key.
     */
    public static JsonRequest etherscanDaily(String action, String field, String pointer) {
        return JsonRequest.get("{etherscan}?module=stats&action=" + action
                        + "&startdate={startDate}&enddate={endDate}&sort=asc&apikey={etherscanKey}")
                .rows("/result")
                .date("/UTCDate")
                .timestamp("/unixTimeStamp")
                .field(field, pointer)
                .expect("/status", "1")
                .build();
    }

    public static RestJsonTier etherscanDailyTier(String action, String field, String pointer) {
        return RestJsonTier.paged(ETHERSCAN, SourceApi.ETHERSCAN, Pagination.dateChunks(ETHERSCAN_CHUNK_DAYS),
                etherscanDaily(action, field, pointer));
    }

    /**
     * DefiLlama daily chart of {@code [{date, tvl}]} for a chain name or {@code {dimension}}.
     */
    public static RestJsonTier defiLlamaChainTvl(String chain) {
        return RestJsonTier.of(DEFILLAMA, SourceApi.DEFILLAMA,
                JsonRequest.get("{defillama}/v2/historicalChainTvl/" + chain)
                        .date("/date")
                        .field("tvl", "/tvl")
                        .build());
    }

    /**
     * Ethereum-chain TVL history of the protocol named by {@code {dimension}}.
     */
    public static RestJsonTier defiLlamaProtocolTvl() {
        return RestJsonTier.of(DEFILLAMA, SourceApi.DEFILLAMA,
                JsonRequest.get("{defillama}/protocol/{dimension}")
                        .rows("/chainTvls/Ethereum/tvl")
                        .date("/date")
                        .field("tvl", "/totalLiquidityUSD")
                        .build());
    }

    /**
     * DefiLlama overview endpoints ({@code fees}, {@code dexs}) expose {@code totalDataChart: [[ts, value], ...]}.
     */
    public static RestJsonTier defiLlamaDataChart(String path, String field) {
        return RestJsonTier.of(DEFILLAMA, SourceApi.DEFILLAMA,
                JsonRequest.get("{defillama}" + path)
                        .rows("/totalDataChart")
                        .date("/0")
                        .field(field, "/1")
                        .build());
    }

    /**
     * Lido stETH 7-day SMA APR snapshot.
     */
    public static RestJsonTier lidoSmaApr(String field) {
        return RestJsonTier.of("lido", SourceApi.LIDO,
                JsonRequest.get("{lido}/v1/protocol/steth/apr/sma")
                        .rows("/data")
                        .field(field, "/smaApr")
                        .build());
    }
}
