package com.ethval.ingestion.config;

import com.ethval.catalog.SourceApi;
import com.ethval.common.RateLimiter;
import com.ethval.common.RetryPolicy;
import com.ethval.config.CaffeineConfig;
import com.ethval.ingestion.adapter.ApiRateLimiters;
import com.ethval.ingestion.adapter.SourceHttpClient;
import com.github.benmanes.caffeine.cache.Cache;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Source adapter wiring: HTTP client with timeouts and manual redirects, per-API rate limiters, retry policy.
 */
@Configuration
@EnableConfigurationProperties({ CollectorProperties.class, SourceProperties.class })
public class IngestionAdapterConfig {

    /** CoinGecko free tier allows about 30 calls per minute. */
    private static final int COINGECKO_REQUESTS_PER_MINUTE = 25;
    private static final int MAX_RESPONSE_BYTES = 32 * 1024 * 1024;

    @Autowired
    private CollectorProperties collectorProperties;

    private RetryPolicy retryPolicy() {
        CollectorProperties.Retry retry = collectorProperties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean
    public ApiRateLimiters apiRateLimiters() {
        Map<SourceApi, RateLimiter> overrides = new EnumMap<>(SourceApi.class);
        overrides.put(SourceApi.COINGECKO, RateLimiter.perMinute(COINGECKO_REQUESTS_PER_MINUTE));
        return new ApiRateLimiters(Duration.ofMillis(collectorProperties.getRateLimitDelayMs()), overrides);
    }

    @Bean
    public WebClient sourceWebClient(WebClient.Builder webClientBuilder) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, collectorProperties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(collectorProperties.getReadTimeoutSeconds()))
                .followRedirect(false);
        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .defaultHeader("User-Agent", "ethval-collector/0.1")
                .build();
    }

    @Bean
    public SourceHttpClient sourceHttpClient(WebClient sourceWebClient, ApiRateLimiters apiRateLimiters,
                                             @Qualifier(CaffeineConfig.SOURCE_RESPONSE_CACHE)
                                             Cache<String, String> sourceResponseCache) {
        return new SourceHttpClient(sourceWebClient, apiRateLimiters, retryPolicy(), sourceResponseCache,
                Duration.ofSeconds(collectorProperties.getReadTimeoutSeconds()), collectorProperties.getMaxRedirects());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Source of regime estimates; seeded only in tests. */
    @Bean
    public Random estimateRandom() {
        return new Random();
    }
}
