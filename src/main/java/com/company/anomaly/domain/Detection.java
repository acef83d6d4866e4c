package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.DetectionRuleType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of running every enabled rule against one observation
 */
@Value
@Builder
public class Detection {
    AnomalyState state;
    @Singular("evidence")
    List<AnomalyEvidence> evidence;
    /** observed / floored reference, absent without a reference */
    Double ratio;

    public boolean isAnomalous() {
        return evidence.stream().anyMatch(AnomalyEvidence::isTriggered);
    }

    public boolean triggered(DetectionRuleType rule) {
        return evidence.stream().anyMatch(e -> e.getRule() == rule && e.isTriggered());
    }
}
