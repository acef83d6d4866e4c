package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class RegistryClassification {
    boolean known;
    ProblemRegistryEntry entry;
    /** Fuzzy candidates: same category and detection type, other signature. Never merged. */
    @Singular
    List<String> similarKeys;

    public Optional<ProblemRegistryEntry> entry() {
        return Optional.ofNullable(entry);
    }

    public static RegistryClassification unknown(List<String> similarKeys) {
        return RegistryClassification.builder().known(false).similarKeys(similarKeys).build();
    }
}
