package com.company.anomaly.domain.enums;

public enum CycleStatus {
    RUNNING("Window claimed, commit in progress"),
    COMPLETED("Window committed"),
    ABORTED("Window failed, nothing applied");

    private final String description;

    CycleStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static CycleStatus fromString(String status) {
        if (status == null) {
            return RUNNING;
        }
        try {
            return CycleStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return RUNNING;
        }
    }
}
