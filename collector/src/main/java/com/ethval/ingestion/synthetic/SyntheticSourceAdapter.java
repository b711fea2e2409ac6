package com.ethval.ingestion.synthetic;

import com.ethval.catalog.InterpolationTier;
import com.ethval.catalog.RegimeTier;
import com.ethval.catalog.TierSpec;
import com.ethval.domain.MetricRecord;
import com.ethval.ingestion.adapter.EmptyResultException;
import com.ethval.ingestion.adapter.FetchContext;
import com.ethval.ingestion.adapter.RawRow;
import com.ethval.ingestion.adapter.SourceAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Deterministic-generator tiers: anchor interpolation and regime estimates. No network access; the rows
 * go through the normalizer like any other tier.
 */
@Component
@RequiredArgsConstructor
public class SyntheticSourceAdapter implements SourceAdapter {

    private final Interpolator interpolator;
    private final RegimeEstimator regimeEstimator;
    private final Random estimateRandom;

    @Override
    public boolean supports(TierSpec tier) {
        return tier instanceof InterpolationTier || tier instanceof RegimeTier;
    }

    @Override
    public List<RawRow> fetch(TierSpec tier, FetchContext context) {
        List<MetricRecord> generated;
        if (tier instanceof InterpolationTier interpolation) {
            generated = interpolator.interpolate(interpolation.anchors(), context.metric().schema(),
                    context.window().to());
        } else {
            generated = regimeEstimator.estimate(((RegimeTier) tier).regimes(), context.metric().schema(),
                    context.window(), estimateRandom);
        }
        List<RawRow> rows = generated.stream()
                .filter(r -> context.window().contains(r.getDate()))
                .map(r -> new RawRow(r.getDate().toString(), null, r.getValues(), r.getSource()))
                .toList();
        if (rows.isEmpty()) {
            throw new EmptyResultException(tier.sourceTag() + " generated nothing inside " + context.window());
        }
        return rows;
    }
}
