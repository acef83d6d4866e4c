package com.company.anomaly.exception;

/**
 * Persisted state unreachable or a statement failed. Aborts the whole cycle.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
