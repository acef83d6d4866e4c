package com.company.anomaly.source;

import lombok.Value;

@Value(staticConstructor = "of")
public class Fingerprint {
    String fingerprintId;
    String errorType;
}
