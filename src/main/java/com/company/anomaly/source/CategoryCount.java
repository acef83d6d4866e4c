package com.company.anomaly.source;

import lombok.Value;

/**
 * Raw count as delivered upstream. Validated before it becomes an observation.
 */
@Value(staticConstructor = "of")
public class CategoryCount {
    String categoryKey;
    Number count;
}
