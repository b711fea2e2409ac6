package com.ethval.ingestion.store;

import java.time.LocalDate;

/**
 * Outcome of a completed write: records upserted, batches executed and the covered date range
 * (null bounds when nothing was written).
 */
public record WriteResult(int count, int batches, LocalDate dateFrom, LocalDate dateTo) {

    public static WriteResult empty() {
        return new WriteResult(0, 0, null, null);
    }
}
