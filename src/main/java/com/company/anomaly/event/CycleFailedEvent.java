package com.company.anomaly.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class CycleFailedEvent {
    private final String cycleId;
    private final Instant windowStart;
    private final String errorType;
    private final String reason;
}
