package com.ethval.ingestion.status;

import com.ethval.catalog.MetricCatalog;
import com.ethval.catalog.MetricDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates a PENDING status row for every catalog metric that has none.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollectionStatusSeeder {

    private final MetricCatalog catalog;
    private final CollectionStatusTracker tracker;

    public int seedMissing() {
        int created = 0;
        for (MetricDefinition metric : catalog.all()) {
            if (tracker.seedIfMissing(metric.name())) {
                created++;
            }
        }
        if (created > 0) {
            log.info("Seeded {} pending dataset status rows", created);
        }
        return created;
    }
}
