package com.inboxpilot.core.persistence;

/**
 * Thrown when a snapshot or ledger operation cannot reach durable storage.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
