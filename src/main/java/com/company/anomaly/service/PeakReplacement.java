package com.company.anomaly.service;

import com.company.anomaly.domain.Detection;
import com.company.anomaly.domain.Observation;
import com.company.anomaly.domain.Reference;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides the value the baseline learns from. An anomaly is replaced by its reference so it
 * never inflates the statistics that judge future observations. Without a reference there is
 * nothing to substitute and the first value becomes the slot's baseline.
 */
@Component
public class PeakReplacement {

    public double valueToWrite(Observation observation, Optional<Reference> reference, Detection detection) {
        if (detection.isAnomalous() && reference.isPresent()) {
            return reference.get().getValue();
        }
        return observation.getRawCount();
    }
}
