package com.ethval.ingestion.resolver;

import com.ethval.catalog.EnrichmentSpec;
import com.ethval.catalog.MetricDefinition;
import com.ethval.domain.MetricRecord;
import com.ethval.domain.RecordKey;
import com.ethval.ingestion.adapter.FetchContext;
import com.ethval.ingestion.adapter.RawRow;
import com.ethval.ingestion.adapter.SourceAdapterRegistry;
import com.ethval.ingestion.adapter.SourceFetchException;
import com.ethval.ingestion.normalizer.NormalizationException;
import com.ethval.ingestion.normalizer.RecordNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a metric's live snapshot enrichments to today's record of a merged series. A replacing snapshot
 * takes the place of today's record whole, fields it lacks included. Enrichment failures are returned as
 * warnings; the series is never lost because of them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotEnricher {

    private final SourceAdapterRegistry adapters;
    private final RecordNormalizer normalizer;

    /**
     * @param records  merged series, sorted
     * @param warnings receives one entry per failed enrichment
     * @return the enriched series (same order; a replaced record appended when today was absent)
     */
    public List<MetricRecord> enrich(List<MetricRecord> records, FetchContext context, List<String> warnings) {
        MetricDefinition metric = context.metric();
        Map<RecordKey, MetricRecord> byKey = new LinkedHashMap<>();
        records.forEach(r -> byKey.put(r.key(), r));
        LocalDate today = context.window().to();
        for (EnrichmentSpec enrichment : metric.enrichments()) {
            context.deadline().check("enrichment " + enrichment.tier().sourceTag() + " of " + metric.name());
            String source = enrichment.tier().sourceTag();
            MetricRecord snapshot;
            try {
                snapshot = snapshotFor(enrichment, context, today);
            } catch (SourceFetchException | NormalizationException e) {
                warnings.add("Enrichment " + source + " failed: " + e.getMessage());
                log.warn("{} enrichment {} failed: {}", context.label(), source, e.getMessage());
                continue;
            }
            RecordKey key = snapshot.key();
            MetricRecord current = byKey.get(key);
            if (enrichment.mode() == EnrichmentSpec.Mode.REPLACE_RECORD) {
                byKey.put(key, snapshot);
                log.info("{} {} replaced record for {}", context.label(), source, key.date());
            } else if (current != null) {
                byKey.put(key, current.withValues(snapshot.getValues()).withSource(current.getSource()));
                log.info("{} {} overlaid fields on {}", context.label(), source, key.date());
            } else {
                log.debug("{} {} overlay skipped, no record for {}", context.label(), source, key.date());
            }
        }
        List<MetricRecord> out = new ArrayList<>(byKey.values());
        out.sort((a, b) -> a.key().compareTo(b.key()));
        return out;
    }

    private MetricRecord snapshotFor(EnrichmentSpec enrichment, FetchContext context, LocalDate today) {
        List<RawRow> rows = adapters.adapterFor(enrichment.tier()).fetch(enrichment.tier(), context);
        MetricRecord latest = null;
        for (RawRow row : rows) {
            MetricRecord record = normalizer.normalize(row, context.metric(), context.dimension());
            if (record.getDate().equals(today)) {
                latest = record;
            }
        }
        if (latest == null) {
            throw new NormalizationException("no snapshot row for " + today);
        }
        return latest;
    }
}
