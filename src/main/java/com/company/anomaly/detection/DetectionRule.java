package com.company.anomaly.detection;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.AnomalyEvidence;
import com.company.anomaly.domain.enums.DetectionRuleType;

/**
 * One independent anomaly signal. Always returns evidence, triggered or not.
 */
public interface DetectionRule {

    DetectionRuleType type();

    AnomalyEvidence evaluate(RuleInput input, DetectionConfig config);
}
