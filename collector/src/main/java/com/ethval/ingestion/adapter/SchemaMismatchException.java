package com.ethval.ingestion.adapter;

/**
 * The body parsed but an expected field or status was missing or malformed.
 */
public class SchemaMismatchException extends SourceFetchException {

    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
