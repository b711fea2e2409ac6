package com.ethval.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pool for metrics when ethval.collector.parallelism is above 1. Unused in sequential runs.
 */
@Configuration
public class AsyncConfig {

    public static final String COLLECTOR_EXECUTOR = "collector-executor";

    @Bean(name = COLLECTOR_EXECUTOR)
    public Executor collectorExecutor(@Value("${ethval.collector.parallelism:1}") int parallelism) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, parallelism));
        e.setMaxPoolSize(Math.max(1, parallelism));
        e.setThreadNamePrefix("collector-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
