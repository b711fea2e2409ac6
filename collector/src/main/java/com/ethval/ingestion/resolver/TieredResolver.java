package com.ethval.ingestion.resolver;

import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.TierSpec;
import com.ethval.domain.DateWindow;
import com.ethval.domain.MetricRecord;
import com.ethval.domain.RecordKey;
import com.ethval.domain.SourceTag;
import com.ethval.ingestion.adapter.EmptyResultException;
import com.ethval.ingestion.adapter.FetchContext;
import com.ethval.ingestion.adapter.RawRow;
import com.ethval.ingestion.adapter.SourceAdapterRegistry;
import com.ethval.ingestion.adapter.SourceFetchException;
import com.ethval.ingestion.config.CollectorProperties;
import com.ethval.ingestion.normalizer.NormalizedRows;
import com.ethval.ingestion.normalizer.RecordNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a metric by walking its tiers in priority order: live sources first, stopping as soon as the
 * keys collected so far reach the metric's minimum history; the terminal synthetic tier only runs when
 * live coverage stays below it. Rows of an insufficient tier are kept and later tiers only fill the
 * keys it left open. Composite series resolve every dimension independently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TieredResolver {

    private final SourceAdapterRegistry adapters;
    private final RecordNormalizer normalizer;
    private final RecordMerger merger;
    private final SnapshotEnricher enricher;
    private final CollectorProperties properties;

    /**
     * @throws AllTiersExhaustedException when no tier produced a record for any dimension
     * @throws com.ethval.common.RunCancelledException when the run deadline passes between tiers
     */
    public ResolvedSeries resolve(MetricDefinition metric, FetchContext context) {
        List<String> dimensions = metric.key().isComposite()
                ? metric.key().dimensions()
                : Collections.singletonList(null);
        List<String> warnings = new ArrayList<>();
        List<TierOutcome> outcomes = new ArrayList<>();
        List<List<MetricRecord>> perDimension = new ArrayList<>();
        List<String> failedDimensions = new ArrayList<>();

        for (String dimension : dimensions) {
            FetchContext dimContext = context.forDimension(dimension);
            List<MetricRecord> resolved = resolveDimension(metric, dimContext, outcomes);
            if (resolved.isEmpty()) {
                failedDimensions.add(dimension == null ? metric.name() : dimension);
                warnings.add(dimContext.label() + " all tiers failed");
            } else {
                perDimension.add(resolved);
            }
        }
        if (perDimension.isEmpty()) {
            throw new AllTiersExhaustedException(metric.name() + ": all tiers failed for "
                    + String.join(", ", failedDimensions));
        }

        List<MetricRecord> records = merger.merge(perDimension);
        if (!metric.key().isComposite() && !metric.enrichments().isEmpty()) {
            records = enricher.enrich(records, context, warnings);
        }

        long synthetic = records.stream().filter(r -> SourceTag.isSynthetic(r.getSource())).count();
        QualityTag quality;
        if (!failedDimensions.isEmpty()) {
            quality = QualityTag.PARTIAL;
        } else if (synthetic > 0) {
            quality = QualityTag.ESTIMATED;
            warnings.add(synthetic + " of " + records.size() + " records are estimated");
        } else {
            quality = QualityTag.SUCCESS;
        }
        return new ResolvedSeries(records, quality, warnings, outcomes);
    }

    private List<MetricRecord> resolveDimension(MetricDefinition metric, FetchContext context,
                                                List<TierOutcome> outcomes) {
        int minRows = metric.minRows(properties.getMinHistoryRows());
        Set<RecordKey> claimed = new HashSet<>();
        List<List<MetricRecord>> tierRecords = new ArrayList<>();
        for (TierSpec tier : metric.tiers()) {
            if (claimed.size() >= minRows) {
                log.debug("{} {} keys collected, skipping {}", context.label(), claimed.size(), tier.sourceTag());
                break;
            }
            context.deadline().check("tier " + tier.sourceTag() + " of " + context.label());
            try {
                List<RawRow> rows = adapters.adapterFor(tier).fetch(tier, context);
                NormalizedRows normalized = normalizer.normalizeAll(rows, metric, context.dimension());
                DateWindow window = context.window();
                List<MetricRecord> inWindow = normalized.records().stream()
                        .filter(r -> window.contains(r.getDate()))
                        .toList();
                if (inWindow.isEmpty()) {
                    throw new EmptyResultException(rows.size() + " rows, none usable inside " + window);
                }
                int before = claimed.size();
                inWindow.forEach(r -> claimed.add(r.key()));
                int added = claimed.size() - before;
                tierRecords.add(inWindow);
                outcomes.add(new TierOutcome(context.dimension(), tier.sourceTag(), rows.size(), inWindow.size(),
                        normalized.dropped(), added, null));
                log.info("{} {}: {} records, {} new days", context.label(), tier.sourceTag(), inWindow.size(), added);
            } catch (SourceFetchException e) {
                outcomes.add(TierOutcome.failed(context.dimension(), tier.sourceTag(), e.getMessage()));
                log.warn("{} {} failed: {}", context.label(), tier.sourceTag(), e.getMessage());
            }
        }
        return tierRecords.isEmpty() ? List.of() : merger.merge(tierRecords);
    }
}
