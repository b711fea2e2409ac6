package com.ethval.ingestion.store;

/**
 * A batch failed; batches before it are committed, later ones were not attempted.
 */
public class WriteFailureException extends RuntimeException {

    private final int writtenBeforeFailure;

    public WriteFailureException(String message, int writtenBeforeFailure, Throwable cause) {
        super(message, cause);
        this.writtenBeforeFailure = writtenBeforeFailure;
    }

    public int getWrittenBeforeFailure() {
        return writtenBeforeFailure;
    }
}
