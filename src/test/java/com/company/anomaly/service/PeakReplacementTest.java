package com.company.anomaly.service;

import com.company.anomaly.domain.*;
import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.DetectionRuleType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PeakReplacementTest {

    private final PeakReplacement peakReplacement = new PeakReplacement();

    private final Observation observation = Observation.builder()
            .slot(TimeSlot.of("checkout-api", PeriodOfWeek.of(0, 10, 0)))
            .rawCount(500)
            .windowStart(Instant.parse("2024-01-08T09:00:00Z"))
            .build();

    private final Reference reference = Reference.builder().historicalValue(10.0).historicalMean(10.0).build();

    @Test
    void anomalyIsReplacedByReference() {
        assertThat(peakReplacement.valueToWrite(observation, Optional.of(reference), detection(true)))
                .isEqualTo(10.0);
    }

    @Test
    void normalObservationIsWrittenAsIs() {
        assertThat(peakReplacement.valueToWrite(observation, Optional.of(reference), detection(false)))
                .isEqualTo(500.0);
    }

    @Test
    void anomalyWithoutReferenceSeedsBaselineWithRawValue() {
        assertThat(peakReplacement.valueToWrite(observation, Optional.empty(), detection(true)))
                .isEqualTo(500.0);
    }

    private static Detection detection(boolean triggered) {
        return Detection.builder()
                .state(triggered ? AnomalyState.SPIKE : AnomalyState.NORMAL)
                .evidence(AnomalyEvidence.builder()
                        .rule(DetectionRuleType.RATIO_SPIKE)
                        .observedValue(500)
                        .triggered(triggered)
                        .build())
                .build();
    }
}
