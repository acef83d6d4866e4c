package com.company.anomaly.domain;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class ValidatedBatch {
    List<Observation> observations;
    /** category key to skip reason */
    Map<String, String> skippedCategories;
}
