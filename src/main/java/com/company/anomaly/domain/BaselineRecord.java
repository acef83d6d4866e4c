package com.company.anomaly.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BaselineRecord {
    private TimeSlot slot;
    private double mean;
    private double stddev;
    private long sampleCount;
    private boolean placeholder;
    private Instant lastUpdated;

    /**
     * Mean as seen by reference computations
     */
    public double flooredMean(double floorValue) {
        return Math.max(mean, floorValue);
    }
}
