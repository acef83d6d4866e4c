package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.ReviewStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Ambiguous registry match waiting for a human decision
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistryReviewItem {
    private Long reviewId;
    private String problemKey;
    private List<String> candidateKeys;
    private String reason;
    private Instant windowStart;
    private ReviewStatus status;
    private Instant createdAt;
}
