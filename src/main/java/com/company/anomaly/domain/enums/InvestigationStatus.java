package com.company.anomaly.domain.enums;

public enum InvestigationStatus {
    NEW("Recorded, nobody has looked at it yet"),
    ACKNOWLEDGED("Someone is looking at it"),
    RESOLVED("Closed by an operator");

    private final String description;

    InvestigationStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    /**
     * Only forward moves are allowed: NEW to ACKNOWLEDGED or RESOLVED, ACKNOWLEDGED to RESOLVED
     */
    public boolean canTransitionTo(InvestigationStatus target) {
        return target != null && target.ordinal() > this.ordinal();
    }

    public static InvestigationStatus fromString(String status) {
        if (status == null) {
            return NEW;
        }
        try {
            return InvestigationStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return NEW;
        }
    }
}
