package com.ethval.ingestion.normalizer;

/**
 * A raw row that cannot become a record. Row-local: the row is dropped, the batch continues.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
