package com.ethval.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB configuration: Decimal128 codec for metric values and status documents, lowercase bookkeeping
 * enums, plus socket and server selection timeouts. Metric collection indexes are created by the store on first write;
 * status and log indexes come from @Indexed / @CompoundIndex.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        List<Converter<?, ?>> converters = new ArrayList<>(Arrays.asList(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()
        ));
        converters.addAll(LowercaseValueConverters.all());
        return new MongoCustomConversions(converters);
    }

    @Bean
    public MongoClientSettingsBuilderCustomizer collectorTimeouts(
            @Value("${ethval.collector.connect-timeout-seconds:10}") int connectTimeoutSeconds,
            @Value("${ethval.collector.write-timeout-seconds:60}") int writeTimeoutSeconds) {
        return builder -> builder
                .applyToSocketSettings(s -> s
                        .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                        .readTimeout(writeTimeoutSeconds, TimeUnit.SECONDS))
                .applyToClusterSettings(c -> c.serverSelectionTimeout(connectTimeoutSeconds, TimeUnit.SECONDS));
    }
}
