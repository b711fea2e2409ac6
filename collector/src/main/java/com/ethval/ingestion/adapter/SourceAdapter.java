package com.ethval.ingestion.adapter;

import com.ethval.catalog.TierSpec;

import java.util.List;

/**
 * Fetches the raw rows of one tier. Implementations are stateless and safe to retry.
 */
public interface SourceAdapter {

    boolean supports(TierSpec tier);

    /**
     * @return the tier's rows, never empty
     * @throws SourceUnavailableException network or HTTP failure
     * @throws SchemaMismatchException    expected field missing or malformed body
     * @throws EmptyResultException       the source answered with zero rows
     */
    List<RawRow> fetch(TierSpec tier, FetchContext context);
}
