package com.ethval.ingestion.store;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Filter for reading a metric collection. Results are sorted by date, then dimension.
 *
 * @param from           inclusive, null for unbounded
 * @param to             inclusive, null for unbounded
 * @param dimensionField name of the dimension field of composite series, null otherwise
 * @param nullFields     fields that must be null or absent
 * @param limit          0 for no limit
 */
public record StoreQuery(LocalDate from, LocalDate to, String dimensionField, List<String> nullFields, int limit) {

    public StoreQuery {
        nullFields = List.copyOf(nullFields);
    }

    public static StoreQuery all() {
        return new StoreQuery(null, null, null, List.of(), 0);
    }

    public static StoreQuery between(LocalDate from, LocalDate to) {
        return new StoreQuery(from, to, null, List.of(), 0);
    }

    public StoreQuery whereNull(String field) {
        List<String> fields = new ArrayList<>(nullFields);
        fields.add(field);
        return new StoreQuery(from, to, dimensionField, fields, limit);
    }

    public StoreQuery withDimensionField(String field) {
        return new StoreQuery(from, to, field, nullFields, limit);
    }
}
