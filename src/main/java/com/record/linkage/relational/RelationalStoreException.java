package com.record.linkage.relational;

/**
 * Thrown when the relational store fails while staging or cleaning up tables.
 */
public class RelationalStoreException extends RuntimeException {

    public RelationalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
