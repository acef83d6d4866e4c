package com.company.anomaly.detection;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.AnomalyEvidence;
import com.company.anomaly.domain.enums.DetectionRuleType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Robust deviation band over the same slot in previous weeks: median + k * MAD.
 * Catches elevated levels that stay below the ratio threshold.
 */
@Component
public class BurstDeviationRule implements DetectionRule {

    @Override
    public DetectionRuleType type() {
        return DetectionRuleType.BURST_DEVIATION;
    }

    @Override
    public AnomalyEvidence evaluate(RuleInput input, DetectionConfig config) {
        long observed = input.observed();
        List<Double> history = input.getHistory();

        if (history.size() < config.getBurstMinHistory()) {
            return AnomalyEvidence.builder()
                    .rule(type())
                    .observedValue(observed)
                    .triggered(false)
                    .detail(String.format("insufficient history (%d of %d)", history.size(), config.getBurstMinHistory()))
                    .build();
        }

        double median = RobustStatistics.median(history);
        double mad = Math.max(RobustStatistics.medianAbsoluteDeviation(history, median), config.getFloorValue());
        double threshold = median + config.getBurstDeviationK() * mad;

        AnomalyEvidence.AnomalyEvidenceBuilder evidence = AnomalyEvidence.builder()
                .rule(type())
                .baselineValue(median)
                .observedValue(observed)
                .threshold(threshold);

        if (observed < config.getAbsoluteFloorValue()) {
            return evidence.triggered(false)
                    .detail(String.format("observed %d below absolute floor %d", observed, config.getAbsoluteFloorValue()))
                    .build();
        }

        boolean triggered = observed >= threshold;
        return evidence.triggered(triggered)
                .detail(String.format("median %.2f, mad %.2f over %d weeks", median, mad, history.size()))
                .build();
    }
}
