package com.company.anomaly.exception;

import com.company.anomaly.domain.enums.InvestigationStatus;

public class InvalidStatusTransitionException extends RuntimeException {
    public InvalidStatusTransitionException(Long investigationId, InvestigationStatus from, InvestigationStatus to) {
        super("Investigation " + investigationId + " cannot move from " + from + " to " + to);
    }
}
