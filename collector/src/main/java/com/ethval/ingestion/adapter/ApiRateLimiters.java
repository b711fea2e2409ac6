package com.ethval.ingestion.adapter;

import com.ethval.catalog.SourceApi;
import com.ethval.common.RateLimiter;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * One {@link RateLimiter} per class of external API, shared by all metrics of a run.
 */
public class ApiRateLimiters {

    private final Map<SourceApi, RateLimiter> limiters = new EnumMap<>(SourceApi.class);

    /**
     * @param defaultInterval interval for every API without an override
     * @param overrides       per-API limiter, e.g. a slower one for CoinGecko's free tier
     */
    public ApiRateLimiters(Duration defaultInterval, Map<SourceApi, RateLimiter> overrides) {
        for (SourceApi api : SourceApi.values()) {
            limiters.put(api, overrides.getOrDefault(api, new RateLimiter(defaultInterval)));
        }
    }

    public RateLimiter forApi(SourceApi api) {
        return limiters.get(api);
    }
}
