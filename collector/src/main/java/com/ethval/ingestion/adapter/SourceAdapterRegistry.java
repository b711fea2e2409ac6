package com.ethval.ingestion.adapter;

import com.ethval.catalog.TierSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the adapter for a tier kind. Every tier kind in the catalog has exactly one adapter.
 */
@Component
@RequiredArgsConstructor
public class SourceAdapterRegistry {

    private final List<SourceAdapter> adapters;

    public SourceAdapter adapterFor(TierSpec tier) {
        return adapters.stream()
                .filter(a -> a.supports(tier))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No adapter for tier " + tier.getClass().getSimpleName()));
    }
}
