package com.ethval.ingestion.adapter;

import com.ethval.catalog.DerivedTier;
import com.ethval.catalog.TierSpec;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.store.MetricStore;
import com.ethval.ingestion.store.StoreQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes a series from another collection already in the store: annualised standard deviation of
 * daily log returns over a trailing window, in percent ({@code stdev * sqrt(365) * 100}).
 * A day is emitted only when its full trailing window of returns is available.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DerivedSourceAdapter implements SourceAdapter {

    private final MetricStore store;

    @Override
    public boolean supports(TierSpec tier) {
        return tier instanceof DerivedTier;
    }

    @Override
    public List<RawRow> fetch(TierSpec tier, FetchContext context) {
        DerivedTier derived = (DerivedTier) tier;
        DateWindow window = context.window();
        StoreQuery query = StoreQuery.between(window.from().minusDays(derived.windowDays()), window.to());
        List<MetricRecord> source;
        try {
            source = store.query(derived.sourceCollection(), query);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Cannot read " + derived.sourceCollection() + ": " + e.getMessage(), e);
        }
        List<RawRow> rows = rollingVolatility(source, derived).stream()
                .filter(r -> window.contains(LocalDate.parse(r.dateToken())))
                .toList();
        if (rows.isEmpty()) {
            throw new EmptyResultException(derived.sourceCollection() + " has fewer than " + (derived.windowDays() + 1)
                    + " priced " + derived.sourceField() + " values in " + window);
        }
        log.debug("{} derived {} rows from {}", context.label(), rows.size(), derived.sourceCollection());
        return rows;
    }

    static List<RawRow> rollingVolatility(List<MetricRecord> source, DerivedTier tier) {
        List<MetricRecord> priced = source.stream()
                .filter(r -> r.has(tier.sourceField()) && r.decimal(tier.sourceField()).signum() > 0)
                .toList();
        List<RawRow> out = new ArrayList<>();
        double[] returns = new double[priced.size()];
        for (int i = 1; i < priced.size(); i++) {
            double prev = priced.get(i - 1).decimal(tier.sourceField()).doubleValue();
            double cur = priced.get(i).decimal(tier.sourceField()).doubleValue();
            returns[i] = Math.log(cur / prev);
            if (i < tier.windowDays()) {
                continue;
            }
            double mean = 0;
            for (int j = i - tier.windowDays() + 1; j <= i; j++) {
                mean += returns[j];
            }
            mean /= tier.windowDays();
            double variance = 0;
            for (int j = i - tier.windowDays() + 1; j <= i; j++) {
                variance += (returns[j] - mean) * (returns[j] - mean);
            }
            variance /= tier.windowDays() - 1;
            double annualised = Math.sqrt(variance) * Math.sqrt(365) * 100;
            out.add(new RawRow(priced.get(i).getDate().toString(), null,
                    Map.of(tier.targetField(), BigDecimal.valueOf(annualised)), tier.sourceTag()));
        }
        return out;
    }
}
