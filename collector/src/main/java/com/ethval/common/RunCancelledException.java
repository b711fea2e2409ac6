package com.ethval.common;

/**
 * Thrown when the run deadline has passed or the run was cancelled.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message) {
        super(message);
    }
}
