package com.company.anomaly.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Value written to the baseline for one slot in one window, after peak replacement
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineSample {
    private TimeSlot slot;
    private Instant windowStart;
    private double value;
}
