package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.CycleMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class BackfillResult {
    CycleMode mode;
    Instant from;
    Instant to;
    int windows;
    int committed;
    int alreadyProcessed;
    @Singular("failedWindow")
    List<Instant> failedWindows;
}
