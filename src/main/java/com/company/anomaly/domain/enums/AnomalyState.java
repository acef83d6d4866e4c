package com.company.anomaly.domain.enums;

public enum AnomalyState {
    NORMAL("normal", "Observation within expected variation"),
    SPIKE("spike", "Ratio against reference reached the dynamic threshold"),
    BURST("burst", "Sustained level above same-slot median deviation band"),
    NEW_CATEGORY("new_category", "First observation with enough support to be judged");

    private final String detectionType;
    private final String description;

    AnomalyState(String detectionType, String description) {
        this.detectionType = detectionType;
        this.description = description;
    }

    /**
     * Lower snake case token used inside problem keys
     */
    public String getDetectionType() {
        return detectionType;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAnomalous() {
        return this != NORMAL;
    }

    public static AnomalyState fromString(String state) {
        if (state == null) {
            return NORMAL;
        }
        for (AnomalyState candidate : values()) {
            if (candidate.name().equalsIgnoreCase(state) || candidate.detectionType.equalsIgnoreCase(state)) {
                return candidate;
            }
        }
        return NORMAL;
    }
}
