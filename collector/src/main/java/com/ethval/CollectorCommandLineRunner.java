package com.ethval;

import com.ethval.common.RunDeadline;
import com.ethval.ingestion.config.CollectorProperties;
import com.ethval.ingestion.job.BackfillResult;
import com.ethval.ingestion.job.CollectionRunOrchestrator;
import com.ethval.ingestion.job.GasPriceBackfillJob;
import com.ethval.ingestion.job.RunSummary;
import com.ethval.ingestion.status.CollectionStatusSeeder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line: no arguments collects every catalog metric; {@code --metrics=a,b} restricts the run;
 * {@code --backfill-gas-price} patches missing gas prices instead. Exit code 0 when nothing failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ethval.collector", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class CollectorCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String BACKFILL_GAS_PRICE = "backfill-gas-price";
    static final String METRICS = "metrics";

    private final CollectionStatusSeeder statusSeeder;
    private final CollectionRunOrchestrator orchestrator;
    private final GasPriceBackfillJob gasPriceBackfillJob;
    private final CollectorProperties properties;
    private final Clock clock;
    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(BACKFILL_GAS_PRICE)) {
            try {
                BackfillResult result = gasPriceBackfillJob.run(new RunDeadline(clock, properties.getRunTimeout()));
                log.info("Gas price backfill: {} candidates, {} updated, {} not found", result.candidates(),
                        result.updated(), result.notFound());
                exitCode = 0;
            } catch (RuntimeException e) {
                log.error("Gas price backfill failed: {}", e.getMessage(), e);
                exitCode = 1;
            }
            return;
        }
        statusSeeder.seedMissing();
        RunSummary summary = orchestrator.runAll(requestedMetrics(args));
        exitCode = summary.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private List<String> requestedMetrics(ApplicationArguments args) {
        List<String> names = new ArrayList<>();
        List<String> values = args.containsOption(METRICS) ? args.getOptionValues(METRICS) : properties.getMetrics();
        for (String value : values) {
            Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(names::add);
        }
        return names;
    }
}
