package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything decided for one observation before the cycle writes anything
 */
@Value
@Builder
public class SlotDecision {
    Observation observation;
    Reference reference;
    Detection detection;
    double replacementValue;
    ProblemKey problemKey;
    boolean knownProblem;
    /** Non-empty when the registry match was ambiguous and needs review */
    @Builder.Default
    List<String> reviewCandidates = List.of();

    public boolean isAnomalous() {
        return detection.isAnomalous();
    }

    public boolean needsReview() {
        return !reviewCandidates.isEmpty();
    }
}
