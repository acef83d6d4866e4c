package com.company.anomaly.detection;

import com.company.anomaly.domain.Observation;
import com.company.anomaly.domain.Reference;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class RuleInput {
    Observation observation;
    /** Absent when neither a same-day nor a historical value exists */
    Reference reference;
    /** Same-slot values of previous weeks, newest first */
    @Builder.Default
    List<Double> history = List.of();

    public Optional<Reference> reference() {
        return Optional.ofNullable(reference);
    }

    public long observed() {
        return observation.getRawCount();
    }
}
