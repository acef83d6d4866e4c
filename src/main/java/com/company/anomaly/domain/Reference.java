package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Combined reference for one slot. Component values are already floored.
 */
@Value
@Builder
public class Reference {
    Double sameDayValue;
    int sameDayCount;
    Double historicalValue;
    /** Historical mean before flooring, absent when the slot has no record */
    Double historicalMean;

    public double getValue() {
        if (sameDayValue != null && historicalValue != null) {
            return (sameDayValue + historicalValue) / 2.0;
        }
        return sameDayValue != null ? sameDayValue : historicalValue;
    }

    /**
     * Magnitude used to pick the ratio threshold; falls back to the combined value
     */
    public double getBaselineMean() {
        return historicalMean != null ? historicalMean : getValue();
    }

    public Optional<Double> sameDay() {
        return Optional.ofNullable(sameDayValue);
    }

    public Optional<Double> historical() {
        return Optional.ofNullable(historicalValue);
    }
}
