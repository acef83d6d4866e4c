package com.company.anomaly.exception;

/**
 * Upstream log source unreachable, failed or timed out. Aborts the whole cycle.
 */
public class FetchException extends RuntimeException {
    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
