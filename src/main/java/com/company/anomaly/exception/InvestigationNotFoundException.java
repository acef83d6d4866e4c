package com.company.anomaly.exception;

public class InvestigationNotFoundException extends RuntimeException {
    public InvestigationNotFoundException(Long investigationId) {
        super("Investigation not found: " + investigationId);
    }
}
