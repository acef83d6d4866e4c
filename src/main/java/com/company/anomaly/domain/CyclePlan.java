package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CyclePlan {
    String cycleId;
    Instant windowStart;
    Instant windowEnd;
    Instant startedAt;
    List<SlotDecision> decisions;
    /** Slots handed to grid completion after the baseline writes */
    List<TimeSlot> gridSlots;
    Map<String, String> skippedCategories;
    Long totalHits;
    Long returnedHits;

    public long anomalyCount() {
        return decisions.stream().filter(SlotDecision::isAnomalous).count();
    }

    public long knownAnomalyCount() {
        return decisions.stream().filter(d -> d.isAnomalous() && d.isKnownProblem()).count();
    }
}
