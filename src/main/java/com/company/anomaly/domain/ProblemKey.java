package com.company.anomaly.domain;

import lombok.Value;

/**
 * Stable identity of a recurring anomaly: {@code category:signature:detectionType}
 */
@Value
public class ProblemKey {

    private static final String SEPARATOR = ":";

    String categoryKey;
    String signature;
    String detectionType;

    public static ProblemKey of(String categoryKey, String signature, String detectionType) {
        if (signature == null || signature.isBlank() || signature.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid error signature: " + signature);
        }
        if (detectionType == null || detectionType.isBlank() || detectionType.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid detection type: " + detectionType);
        }
        return new ProblemKey(categoryKey, signature, detectionType);
    }

    /**
     * Category keys may contain the separator, so parsing works from the right
     */
    public static ProblemKey parse(String value) {
        int typeSep = value == null ? -1 : value.lastIndexOf(SEPARATOR);
        int signatureSep = typeSep <= 0 ? -1 : value.lastIndexOf(SEPARATOR, typeSep - 1);
        if (signatureSep <= 0) {
            throw new IllegalArgumentException("Malformed problem key: " + value);
        }
        return of(value.substring(0, signatureSep),
                value.substring(signatureSep + 1, typeSep),
                value.substring(typeSep + 1));
    }

    public String asString() {
        return categoryKey + SEPARATOR + signature + SEPARATOR + detectionType;
    }

    @Override
    public String toString() {
        return asString();
    }
}
