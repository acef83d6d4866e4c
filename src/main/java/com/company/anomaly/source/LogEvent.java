package com.company.anomaly.source;

import lombok.Value;

import java.time.Instant;

@Value(staticConstructor = "of")
public class LogEvent {
    Instant timestamp;
    String categoryKey;
    String message;
}
