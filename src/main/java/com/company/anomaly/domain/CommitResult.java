package com.company.anomaly.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CommitResult {
    int baselineUpdates;
    int placeholdersInserted;
    int investigationsCreated;
    int reviewItemsFiled;
    int problemsPromoted;
    double gridCompletenessPercent;
}
