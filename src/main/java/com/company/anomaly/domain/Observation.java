package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Observation {
    TimeSlot slot;
    long rawCount;
    Instant windowStart;
}
