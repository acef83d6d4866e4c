package com.company.anomaly.exception;

public class ProblemNotFoundException extends RuntimeException {
    public ProblemNotFoundException(String problemKey) {
        super("Problem not found in registry: " + problemKey);
    }
}
