package com.ethval.catalog;

/**
 * Continuation strategy of a REST-JSON tier.
 *
 * @param pageSize rows per page for {@link Mode#END_TIMESTAMP_CURSOR}, substituted as {@code {limit}}
 * @param chunkDays days per request for {@link Mode#DATE_CHUNKS}
 * @param maxPages hard stop on the number of requests
 */
public record Pagination(Mode mode, int pageSize, int chunkDays, int maxPages) {

    public enum Mode {
        /** Single request. */
        NONE,
        /** {@code {toTs}} stepped backward to one day before the earliest row of the previous page. */
        END_TIMESTAMP_CURSOR,
        /** {@code {startDate}}/{@code {endDate}} ranges of {@code chunkDays} covering the window. */
        DATE_CHUNKS
    }

    private static final Pagination NONE_PAGINATION = new Pagination(Mode.NONE, 0, 0, 1);

    public static Pagination none() {
        return NONE_PAGINATION;
    }

    public static Pagination endTimestampCursor(int pageSize) {
        return new Pagination(Mode.END_TIMESTAMP_CURSOR, pageSize, 0, 20);
    }

    public static Pagination dateChunks(int chunkDays) {
        return new Pagination(Mode.DATE_CHUNKS, 0, chunkDays, 20);
    }
}
