package com.company.anomaly.source;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CountBatch {
    @Singular
    List<CategoryCount> counts;
    /** Hits the source matched, null when it cannot tell */
    Long totalHits;
    /** Hits actually aggregated into {@link #counts} */
    Long returnedHits;

    public boolean isComplete() {
        return totalHits == null || returnedHits == null || returnedHits >= totalHits;
    }
}
