package com.company.anomaly.detection;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.Detection;
import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.DetectionRuleType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every enabled rule against one observation. Holds no state between observations.
 */
@Component
@Slf4j
public class AnomalyDetector {

    private final List<DetectionRule> rules;

    public AnomalyDetector(List<DetectionRule> rules) {
        List<DetectionRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparing(DetectionRule::type));
        this.rules = List.copyOf(ordered);
    }

    public Detection detect(RuleInput input, DetectionConfig config) {
        Detection.DetectionBuilder detection = Detection.builder();

        for (DetectionRule rule : rules) {
            if (config.isEnabled(rule.type())) {
                detection.evidence(rule.evaluate(input, config));
            }
        }

        input.reference().ifPresent(reference ->
                detection.ratio(input.observed() / config.floor(reference.getValue())));

        Detection draft = detection.state(AnomalyState.NORMAL).build();
        AnomalyState state = resolveState(draft);

        if (state.isAnomalous()) {
            log.debug("Slot {} observed {} classified {}", input.getObservation().getSlot(), input.observed(), state);
        }
        return detection.state(state).build();
    }

    private static AnomalyState resolveState(Detection detection) {
        if (detection.triggered(DetectionRuleType.NEW_CATEGORY)) {
            return AnomalyState.NEW_CATEGORY;
        }
        if (detection.triggered(DetectionRuleType.RATIO_SPIKE)) {
            return AnomalyState.SPIKE;
        }
        if (detection.triggered(DetectionRuleType.BURST_DEVIATION)) {
            return AnomalyState.BURST;
        }
        return AnomalyState.NORMAL;
    }
}
