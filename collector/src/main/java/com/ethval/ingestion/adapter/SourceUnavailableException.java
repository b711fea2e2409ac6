package com.ethval.ingestion.adapter;

/**
 * Network error, timeout, non-2xx status, redirect loop or missing API key.
 */
public class SourceUnavailableException extends SourceFetchException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
