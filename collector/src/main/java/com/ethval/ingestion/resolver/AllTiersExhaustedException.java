package com.ethval.ingestion.resolver;

/**
 * No tier produced a single record for the metric (for composite series: for any dimension).
 */
public class AllTiersExhaustedException extends RuntimeException {

    public AllTiersExhaustedException(String message) {
        super(message);
    }
}
