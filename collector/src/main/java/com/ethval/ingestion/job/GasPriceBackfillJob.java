package com.ethval.ingestion.job;

import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.MetricCatalog;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.Pagination;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.RestJsonTier;
import com.ethval.catalog.SourceApi;
import com.ethval.catalog.metrics.SourceTiers;
import com.ethval.common.RunDeadline;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.adapter.FetchContext;
import com.ethval.ingestion.adapter.RawRow;
import com.ethval.ingestion.adapter.SourceAdapterRegistry;
import com.ethval.ingestion.adapter.SourceFetchException;
import com.ethval.ingestion.normalizer.RecordNormalizer;
import com.ethval.ingestion.store.MetricStore;
import com.ethval.ingestion.store.StoreQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills {@code avg_gas_price_gwei} on stored gas_burn rows that lack it (rows written by the chart export
 * or by estimates before the Etherscan API was reachable). Only the gas price and the source tag of
 * matching days are patched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GasPriceBackfillJob {

    static final String METRIC = "gas_burn";
    static final String FIELD = "avg_gas_price_gwei";
    private static final int PROGRESS_EVERY = 100;

    private final MetricCatalog catalog;
    private final MetricStore store;
    private final SourceAdapterRegistry adapters;
    private final RecordNormalizer normalizer;

    /**
     * @throws SourceFetchException when Etherscan cannot be read; nothing is patched then
     */
    public BackfillResult run(RunDeadline deadline) {
        MetricDefinition gasBurn = catalog.get(METRIC);
        List<MetricRecord> missing = store.query(gasBurn.collection(), StoreQuery.all().whereNull(FIELD));
        if (missing.isEmpty()) {
            log.info("[{}] no rows without {}", METRIC, FIELD);
            return BackfillResult.nothingToDo();
        }
        LocalDate first = missing.get(0).getDate();
        LocalDate last = missing.get(missing.size() - 1).getDate();
        log.info("[{}] {} rows without {} between {} and {}", METRIC, missing.size(), FIELD, first, last);

        Map<LocalDate, BigDecimal> prices = fetchPrices(gasBurn, new DateWindow(first, last), deadline);
        log.info("[{}] Etherscan returned {} daily gas prices", METRIC, prices.size());

        int updated = 0;
        int notFound = 0;
        int processed = 0;
        for (MetricRecord row : missing) {
            BigDecimal price = prices.get(row.getDate());
            if (price == null) {
                notFound++;
            } else {
                store.patch(gasBurn.collection(), row.key(), Map.of(FIELD, price, "source", SourceTiers.ETHERSCAN));
                updated++;
            }
            processed++;
            if (processed % PROGRESS_EVERY == 0) {
                log.info("[{}] backfill progress {}/{} ({} updated)", METRIC, processed, missing.size(), updated);
            }
        }
        log.info("[{}] backfill done: {} updated, {} without Etherscan value", METRIC, updated, notFound);
        return new BackfillResult(missing.size(), updated, notFound);
    }

    private Map<LocalDate, BigDecimal> fetchPrices(MetricDefinition gasBurn, DateWindow window, RunDeadline deadline) {
        FieldSpec field = gasBurn.schema().field(FIELD)
                .orElseThrow(() -> new IllegalStateException(METRIC + " has no " + FIELD + " field"));
        MetricDefinition gasPriceOnly = MetricDefinition.builder(METRIC)
                .collection(gasBurn.collection())
                .schema(RecordSchema.of(field))
                .tier(RestJsonTier.paged(SourceTiers.ETHERSCAN, SourceApi.ETHERSCAN, Pagination.dateChunks(365),
                        SourceTiers.etherscanDaily("dailyavggasprice", FIELD, "/avgGasPrice_Wei")))
                .build();
        RestJsonTier tier = (RestJsonTier) gasPriceOnly.tiers().get(0);
        FetchContext context = new FetchContext(gasPriceOnly, window, null, deadline);
        List<RawRow> rows = adapters.adapterFor(tier).fetch(tier, context);
        Map<LocalDate, BigDecimal> prices = new HashMap<>();
        for (MetricRecord record : normalizer.normalizeAll(rows, gasPriceOnly, null).records()) {
            BigDecimal price = record.decimal(FIELD);
            if (price != null) {
                prices.putIfAbsent(record.getDate(), price);
            }
        }
        return prices;
    }
}
