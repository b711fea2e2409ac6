package com.ethval.ingestion.store;

import com.ethval.catalog.KeyDefinition;
import com.ethval.domain.MetricRecord;
import com.ethval.domain.RecordKey;

import java.util.List;
import java.util.Map;

/**
 * Metric collections in the external store. Upserts are keyed by the record's natural key and never
 * create a second document for a key.
 */
public interface MetricStore {

    List<MetricRecord> query(String collection, StoreQuery query);

    /**
     * Inserts records whose key is absent and overwrites the non-key fields of the others.
     */
    void upsert(String collection, List<MetricRecord> records, KeyDefinition key);

    /**
     * Sets {@code fields} on the record with {@code key}.
     *
     * @return number of documents modified (0 or 1)
     */
    long patch(String collection, RecordKey key, Map<String, Object> fields);

    /**
     * Unique index on the conflict key; the store, not the merge, guarantees one document per key.
     */
    void ensureIndexes(String collection, KeyDefinition key);

    long count(String collection);
}
