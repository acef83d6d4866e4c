package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.InvestigationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Audit trail of one anomalous observation. Keeps the raw value the baseline never saw.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationRecord {
    private Long investigationId;
    private TimeSlot slot;
    private Instant windowStart;
    private long originalValue;
    private Double referenceValue;
    private double replacementValue;
    private Double ratio;
    private AnomalyState state;
    private List<AnomalyEvidence> evidence;
    private String problemKey;
    private boolean knownProblem;
    private InvestigationStatus status;
    private String resolutionNotes;
    private Instant createdAt;
    private Instant updatedAt;
}
