package com.company.anomaly.exception;

import java.time.Instant;

public class CycleAlreadyCompletedException extends RuntimeException {
    public CycleAlreadyCompletedException(Instant windowStart) {
        super("Window already committed: " + windowStart);
    }
}
