package com.ethval.ingestion.resolver;

import com.ethval.domain.MetricRecord;
import com.ethval.domain.RecordKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines tier outputs given in priority order. The first tier to claim a key keeps it, and within a
 * tier the first row for a key wins. Output is sorted by date, then dimension.
 */
@Component
public class RecordMerger {

    public List<MetricRecord> merge(List<List<MetricRecord>> tiersInPriorityOrder) {
        Map<RecordKey, MetricRecord> byKey = new LinkedHashMap<>();
        for (List<MetricRecord> tier : tiersInPriorityOrder) {
            for (MetricRecord record : tier) {
                byKey.putIfAbsent(record.key(), record);
            }
        }
        List<MetricRecord> merged = new ArrayList<>(byKey.values());
        merged.sort(Comparator.comparing(MetricRecord::key));
        return merged;
    }
}
