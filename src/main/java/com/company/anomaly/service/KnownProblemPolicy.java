package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.ProblemRegistryEntry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * When a recurring problem stops being new. Occurrences are counted from the last
 * explicit demotion, so a demoted problem has to earn its status again.
 */
@Component
public class KnownProblemPolicy {

    public boolean isKnown(ProblemRegistryEntry entry, DetectionConfig config) {
        if (entry.occurrencesSinceDemotion() >= config.getKnownAfterOccurrences()) {
            return true;
        }
        if (config.getKnownAfterAgeHours() > 0 && entry.getDemotedAtCount() == 0
                && entry.getOccurrenceCount() > 1) {
            Duration age = Duration.between(entry.getFirstSeen(), entry.getLastSeen());
            return age.toHours() >= config.getKnownAfterAgeHours();
        }
        return false;
    }
}
