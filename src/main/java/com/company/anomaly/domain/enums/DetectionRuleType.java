package com.company.anomaly.domain.enums;

public enum DetectionRuleType {
    RATIO_SPIKE("Observed count is a multiple of the reference value"),
    BURST_DEVIATION("Observed count exceeds median + k * MAD of same-slot history"),
    NEW_CATEGORY("No reference exists and the count reaches minimum support");

    private final String description;

    DetectionRuleType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static DetectionRuleType fromString(String rule) {
        if (rule == null) {
            throw new IllegalArgumentException("Detection rule must not be null");
        }
        return DetectionRuleType.valueOf(rule.trim().toUpperCase().replace('-', '_'));
    }
}
