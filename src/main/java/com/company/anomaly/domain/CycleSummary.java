package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Periodic operational summary published after each committed cycle
 */
@Value
@Builder
public class CycleSummary {
    String cycleId;
    Instant windowStart;
    Instant windowEnd;
    int observations;
    Map<String, String> skippedCategories;
    int anomalies;
    int knownAnomalies;
    int newAnomalies;
    int reviewItems;
    int placeholdersInserted;
    double gridCompletenessPercent;
    Long totalHits;
    Long returnedHits;
    long durationMs;
    boolean alreadyProcessed;

    /** Percentage of upstream hits actually returned, 100 when unknown */
    public double fetchCoveragePercent() {
        if (totalHits == null || returnedHits == null || totalHits <= 0) {
            return 100.0;
        }
        return Math.min(100.0, returnedHits * 100.0 / totalHits);
    }
}
