package com.ethval.ingestion.adapter;

/**
 * Tier-local failure of a source. Never aborts a run: the resolver moves on to the next tier.
 */
public abstract class SourceFetchException extends RuntimeException {

    protected SourceFetchException(String message) {
        super(message);
    }

    protected SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
