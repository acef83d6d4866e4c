package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.DetectionRuleType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AnomalyEvidence {
    DetectionRuleType rule;
    Double baselineValue;
    long observedValue;
    Double threshold;
    boolean triggered;
    String detail;
}
