package com.ethval.ingestion.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row as a source delivered it, before normalization. Values are the source's text, or already typed
 * numbers for JSON numbers and generated rows; null means the source had no value.
 *
 * @param dateToken       date in any form the normalizer accepts
 * @param timestampToken  Unix timestamp used when the date token is absent
 */
public record RawRow(String dateToken, String timestampToken, Map<String, Object> values, String source) {

    public RawRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public RawRow withValues(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        extra.forEach(merged::putIfAbsent);
        return new RawRow(dateToken, timestampToken, merged, source);
    }
}
