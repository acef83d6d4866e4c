package com.company.anomaly.domain.enums;

public enum ReviewStatus {
    OPEN,
    CLOSED;

    public static ReviewStatus fromString(String status) {
        if (status == null) {
            return OPEN;
        }
        try {
            return ReviewStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return OPEN;
        }
    }
}
