package com.company.anomaly.event;

import com.company.anomaly.domain.CycleSummary;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CycleCompletedEvent {
    private final CycleSummary summary;
}
