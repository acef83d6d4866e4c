package com.company.anomaly.detection;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.AnomalyEvidence;
import com.company.anomaly.domain.Reference;
import com.company.anomaly.domain.enums.DetectionRuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Observed count as a multiple of the reference.
 * <p>
 * Small baselines use the fixed ratio threshold. From {@code largeBaselineMean} upwards the
 * observation must also reach {@code baselineMean * baselineMultiplier}, which keeps naturally
 * volatile high-traffic categories quiet. Counts under the absolute floor never trigger.
 */
@Component
public class RatioSpikeRule implements DetectionRule {

    @Override
    public DetectionRuleType type() {
        return DetectionRuleType.RATIO_SPIKE;
    }

    @Override
    public AnomalyEvidence evaluate(RuleInput input, DetectionConfig config) {
        long observed = input.observed();
        Optional<Reference> reference = input.reference();

        if (reference.isEmpty()) {
            return AnomalyEvidence.builder()
                    .rule(type())
                    .observedValue(observed)
                    .triggered(false)
                    .detail("no reference, ratio undefined")
                    .build();
        }

        double flooredReference = config.floor(reference.get().getValue());
        double ratio = observed / flooredReference;
        double threshold = effectiveThreshold(reference.get().getBaselineMean(), flooredReference, config);

        AnomalyEvidence.AnomalyEvidenceBuilder evidence = AnomalyEvidence.builder()
                .rule(type())
                .baselineValue(flooredReference)
                .observedValue(observed)
                .threshold(threshold);

        if (observed < config.getAbsoluteFloorValue()) {
            return evidence.triggered(false)
                    .detail(String.format("observed %d below absolute floor %d (ratio %.2f)",
                            observed, config.getAbsoluteFloorValue(), ratio))
                    .build();
        }

        boolean triggered = ratio >= threshold;
        return evidence.triggered(triggered)
                .detail(String.format("ratio %.2f %s threshold %.2f", ratio, triggered ? ">=" : "<", threshold))
                .build();
    }

    static double effectiveThreshold(double baselineMean, double flooredReference, DetectionConfig config) {
        if (baselineMean < config.getLargeBaselineMean()) {
            return config.getRatioThreshold();
        }
        return Math.max(config.getRatioThreshold(),
                baselineMean * config.getBaselineMultiplier() / flooredReference);
    }
}
