package com.company.anomaly.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProblemRegistryEntry {
    private String problemKey;
    private String categoryKey;
    private String signature;
    private String detectionType;
    private Instant firstSeen;
    private Instant lastSeen;
    private long occurrenceCount;
    private boolean known;
    /** Occurrence count at the last explicit demotion, 0 if never demoted */
    private long demotedAtCount;
    private Instant updatedAt;

    public long occurrencesSinceDemotion() {
        return occurrenceCount - demotedAtCount;
    }
}
