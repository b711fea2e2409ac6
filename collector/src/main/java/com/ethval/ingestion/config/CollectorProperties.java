package com.ethval.ingestion.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Collection run settings. Documented in application.yml under ethval.collector.
 */
@ConfigurationProperties(prefix = "ethval.collector")
@Validated
@Getter
@Setter
public class CollectorProperties {

    /**
     * History length in days; the window is [today - days + 1, today] in UTC.
     */
    @Min(1)
    private int daysToFetch = 1095;

    /**
     * Records per upsert batch.
     */
    @Min(1)
    @Max(5000)
    private int batchSize = 500;

    /**
     * Distinct days a live tier must reach before lower tiers are skipped (long-history metrics).
     */
    @Min(1)
    private int minHistoryRows = 100;

    /**
     * Minimum interval between two calls to the same class of API.
     */
    @Min(0)
    private long rateLimitDelayMs = 300;

    /**
     * Pause between metrics when running sequentially.
     */
    @Min(0)
    private long interMetricDelayMs = 500;

    /**
     * Metrics processed concurrently. 1 keeps the sequential behaviour.
     */
    @Min(1)
    @Max(8)
    private int parallelism = 1;

    /**
     * Run-level deadline, checked between metrics, tiers and batches.
     */
    @NotNull
    private Duration runTimeout = Duration.ofHours(2);

    /**
     * Redirects followed manually per request (Etherscan CSV export redirects).
     */
    @Min(0)
    private int maxRedirects = 5;

    @Min(1)
    private int connectTimeoutSeconds = 10;

    @Min(1)
    private int readTimeoutSeconds = 30;

    /**
     * Store write timeout per batch.
     */
    @Min(1)
    private int writeTimeoutSeconds = 60;

    /**
     * TTL of the raw response cache (several metrics share endpoints within a run).
     */
    @Min(1)
    private int responseCacheTtlMinutes = 30;

    /**
     * Run the full collection when the application starts. Disabled in tests.
     */
    private boolean runOnStartup = true;

    /**
     * Restrict the run to these datasets; empty runs the whole catalog.
     */
    private List<String> metrics = new ArrayList<>();

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        /** First backoff delay; doubled per attempt. */
        @Min(0)
        private long baseDelayMs = 1000;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.2;
        /** Attempts per request including the first; 429, 5xx and I/O errors are retried. */
        @Min(1)
        private int maxAttempts = 2;
    }
}
