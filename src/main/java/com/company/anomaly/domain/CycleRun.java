package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.CycleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleRun {
    private Instant windowStart;
    private Instant windowEnd;
    private String cycleId;
    private CycleStatus status;
    private int observations;
    private int skippedCategories;
    private int anomalies;
    private int knownAnomalies;
    private int newAnomalies;
    private Long totalHits;
    private Long returnedHits;
    private String failureReason;
    private Instant startedAt;
    private Instant completedAt;
}
