package com.company.anomaly.detection;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.config.DetectionConfigFixtures;
import com.company.anomaly.domain.AnomalyEvidence;
import com.company.anomaly.domain.Detection;
import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.DetectionRuleType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static com.company.anomaly.detection.RuleInputs.historical;
import static com.company.anomaly.detection.RuleInputs.observation;
import static com.company.anomaly.detection.RuleInputs.withReference;
import static com.company.anomaly.detection.RuleInputs.withoutReference;
import static org.assertj.core.api.Assertions.assertThat;

class AnomalyDetectorTest {

    private final AnomalyDetector detector = new AnomalyDetector(
            List.of(new NewCategoryRule(), new BurstDeviationRule(), new RatioSpikeRule()));
    private final DetectionConfig config = DetectionConfigFixtures.defaults();

    @Test
    void everyEnabledRuleLeavesEvidence() {
        Detection detection = detector.detect(withReference(15, historical(10)), config);

        assertThat(detection.getEvidence())
                .extracting(AnomalyEvidence::getRule)
                .containsExactly(DetectionRuleType.RATIO_SPIKE, DetectionRuleType.BURST_DEVIATION,
                        DetectionRuleType.NEW_CATEGORY);
        assertThat(detection.getState()).isEqualTo(AnomalyState.NORMAL);
        assertThat(detection.isAnomalous()).isFalse();
        assertThat(detection.getRatio()).isEqualTo(1.5);
    }

    @Test
    void disabledRuleLeavesNoEvidence() {
        DetectionConfig ratioOff = config.toBuilder()
                .enabledRules(EnumSet.of(DetectionRuleType.BURST_DEVIATION, DetectionRuleType.NEW_CATEGORY))
                .build();

        Detection detection = detector.detect(withReference(500, historical(10)), ratioOff);

        assertThat(detection.getEvidence())
                .extracting(AnomalyEvidence::getRule)
                .doesNotContain(DetectionRuleType.RATIO_SPIKE);
        assertThat(detection.getState()).isEqualTo(AnomalyState.NORMAL);
    }

    @Test
    void spikeIsClassifiedFromRatioEvidence() {
        Detection detection = detector.detect(withReference(500, historical(10)), config);

        assertThat(detection.getState()).isEqualTo(AnomalyState.SPIKE);
        assertThat(detection.getRatio()).isEqualTo(50.0);
        assertThat(detection.triggered(DetectionRuleType.RATIO_SPIKE)).isTrue();
    }

    @Test
    void burstIsReportedWhenRatioStaysQuiet() {
        RuleInput input = RuleInput.builder()
                .observation(observation(25))
                .reference(historical(10))
                .history(List.of(10.0, 10.0, 11.0, 9.0, 10.0))
                .build();

        Detection detection = detector.detect(input, config);

        assertThat(detection.getState()).isEqualTo(AnomalyState.BURST);
        assertThat(detection.triggered(DetectionRuleType.RATIO_SPIKE)).isFalse();
    }

    @Test
    void newCategoryHasNoRatio() {
        Detection detection = detector.detect(withoutReference(7), config);

        assertThat(detection.getState()).isEqualTo(AnomalyState.NEW_CATEGORY);
        assertThat(detection.getRatio()).isNull();
        assertThat(detection.isAnomalous()).isTrue();
    }
}
