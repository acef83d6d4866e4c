package com.company.anomaly.source;

import java.time.Instant;
import java.util.List;

/**
 * Upstream log store. Implementations handle pagination and transport retries themselves
 * and are expected to throw on failure rather than return partial data silently.
 * <p>
 * Calls are cancelled by thread interrupt when they exceed the configured timeout.
 * Blocking I/O in an implementation must stop promptly once its thread is interrupted.
 */
public interface ErrorLogSource {

    /**
     * Error counts per category for {@code [windowStart, windowEnd)}
     */
    CountBatch fetchCounts(Instant windowStart, Instant windowEnd);

    /**
     * Sample raw events of one category, used to derive the error signature of an anomaly
     */
    List<LogEvent> fetchEvents(String categoryKey, Instant windowStart, Instant windowEnd, int limit);
}
