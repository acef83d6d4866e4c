package com.company.anomaly.domain.enums;

public enum CycleMode {
    /** Judge every observation, record investigations and protect the baseline from peaks */
    DETECT,
    /** Build the baseline only: raw counts are written and nothing is judged */
    LEARN
}
