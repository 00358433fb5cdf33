package com.record.linkage.dispatch;

/**
 * Thrown when a scoring worker fails or a batch times out. Aborts the run.
 */
public class MatchExecutionException extends RuntimeException {

    public MatchExecutionException(String message) {
        super(message);
    }

    public MatchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
