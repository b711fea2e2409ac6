package com.ethval.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * In-process cache of raw source responses by URL. Several metrics read the same endpoint in one run
 * (CoinGecko market chart, DefiLlama chain history).
 */
@Configuration
public class CaffeineConfig {

    public static final String SOURCE_RESPONSE_CACHE = "sourceResponseCache";

    @Bean(name = SOURCE_RESPONSE_CACHE)
    public Cache<String, String> sourceResponseCache(
            @Value("${ethval.collector.response-cache-ttl-minutes:30}") long ttlMinutes) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                .maximumSize(200)
                .build();
    }
}
