package com.company.anomaly.exception;

import lombok.Getter;

/**
 * One category delivered unusable data. Only that category is skipped.
 */
@Getter
public class DataQualityException extends RuntimeException {

    private final String categoryKey;

    public DataQualityException(String categoryKey, String reason) {
        super("Invalid data for category " + categoryKey + ": " + reason);
        this.categoryKey = categoryKey;
    }
}
