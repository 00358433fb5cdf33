package com.record.linkage.blocking;

/**
 * Thrown when a backend cannot generate or stream candidates because its
 * backing store failed. Fatal to the run.
 */
public class CandidateGenerationException extends RuntimeException {

    public CandidateGenerationException(String message) {
        super(message);
    }

    public CandidateGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
