package com.ethval.domain;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Natural key of a metric record: calendar day, plus dimension (chain, protocol) for composite-keyed series.
 * Ordered by date, then dimension; a null dimension sorts first.
 */
public record RecordKey(LocalDate date, String dimension) implements Comparable<RecordKey> {

    private static final Comparator<RecordKey> ORDER = Comparator
            .comparing(RecordKey::date)
            .thenComparing(RecordKey::dimension, Comparator.nullsFirst(Comparator.naturalOrder()));

    public RecordKey {
        Objects.requireNonNull(date, "date");
    }

    public static RecordKey of(LocalDate date) {
        return new RecordKey(date, null);
    }

    /**
     * Deterministic store id: {@code 2024-03-09} or {@code 2024-03-09|Arbitrum}.
     */
    public String documentId() {
        return dimension == null ? date.toString() : date + "|" + dimension;
    }

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }
}
