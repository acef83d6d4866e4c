package com.company.anomaly.detection;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.AnomalyEvidence;
import com.company.anomaly.domain.enums.DetectionRuleType;
import org.springframework.stereotype.Component;

/**
 * The only way a first-ever observation can be anomalous
 */
@Component
public class NewCategoryRule implements DetectionRule {

    @Override
    public DetectionRuleType type() {
        return DetectionRuleType.NEW_CATEGORY;
    }

    @Override
    public AnomalyEvidence evaluate(RuleInput input, DetectionConfig config) {
        long observed = input.observed();
        AnomalyEvidence.AnomalyEvidenceBuilder evidence = AnomalyEvidence.builder()
                .rule(type())
                .observedValue(observed)
                .threshold((double) config.getMinimumSupportCount());

        if (input.reference().isPresent()) {
            return evidence.triggered(false)
                    .baselineValue(input.getReference().getValue())
                    .detail("slot has history")
                    .build();
        }

        boolean triggered = observed >= config.getMinimumSupportCount();
        return evidence.triggered(triggered)
                .detail(triggered ? "no history, support reached" : "no history, support not reached")
                .build();
    }
}
