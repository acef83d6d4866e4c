package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.config.DetectionConfigFixtures;
import com.company.anomaly.domain.ProblemRegistryEntry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class KnownProblemPolicyTest {

    private static final Instant FIRST_SEEN = Instant.parse("2024-01-08T09:00:00Z");

    private final KnownProblemPolicy policy = new KnownProblemPolicy();
    private final DetectionConfig config = DetectionConfigFixtures.defaults();

    @Test
    void becomesKnownAfterEnoughOccurrences() {
        assertThat(policy.isKnown(entry(2, 0, Duration.ofHours(1)), config)).isFalse();
        assertThat(policy.isKnown(entry(3, 0, Duration.ofHours(1)), config)).isTrue();
    }

    @Test
    void demotedEntryNeedsFreshSupport() {
        assertThat(policy.isKnown(entry(5, 4, Duration.ofDays(3)), config)).isFalse();
        assertThat(policy.isKnown(entry(7, 4, Duration.ofDays(3)), config)).isTrue();
    }

    @Test
    void ageRuleOnlyAppliesWhenEnabled() {
        DetectionConfig ageBased = config.toBuilder().knownAfterAgeHours(24).build();
        ProblemRegistryEntry recurring = entry(2, 0, Duration.ofHours(25));

        assertThat(policy.isKnown(recurring, config)).isFalse();
        assertThat(policy.isKnown(recurring, ageBased)).isTrue();
        assertThat(policy.isKnown(entry(1, 0, Duration.ZERO), ageBased)).isFalse();
    }

    private static ProblemRegistryEntry entry(long occurrences, long demotedAt, Duration age) {
        return ProblemRegistryEntry.builder()
                .problemKey("checkout-api:timeout:spike")
                .firstSeen(FIRST_SEEN)
                .lastSeen(FIRST_SEEN.plus(age))
                .occurrenceCount(occurrences)
                .demotedAtCount(demotedAt)
                .build();
    }
}
