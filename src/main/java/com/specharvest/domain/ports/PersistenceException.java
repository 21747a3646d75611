package com.specharvest.domain.ports;

/**
 * Failure reported by the document store.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
