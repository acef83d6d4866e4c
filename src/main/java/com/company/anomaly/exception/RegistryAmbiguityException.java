package com.company.anomaly.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class RegistryAmbiguityException extends RuntimeException {

    private final String problemKey;
    private final List<String> candidateKeys;

    public RegistryAmbiguityException(String problemKey, List<String> candidateKeys) {
        super("Problem " + problemKey + " fuzzy-matches " + candidateKeys.size()
                + " registry entries: " + candidateKeys);
        this.problemKey = problemKey;
        this.candidateKeys = List.copyOf(candidateKeys);
    }
}
