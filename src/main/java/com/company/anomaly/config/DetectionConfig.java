package com.company.anomaly.config;

import com.company.anomaly.domain.enums.DetectionRuleType;
import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of thresholds one cycle runs with. Built fresh for every cycle.
 */
@Value
@Builder(toBuilder = true)
public class DetectionConfig {
    ZoneId zoneId;
    double ratioThreshold;
    double baselineMultiplier;
    /** Baselines below this mean use the plain ratio threshold */
    double largeBaselineMean;
    long minimumSupportCount;
    long absoluteFloorValue;
    double floorValue;
    int sameDayWindowCount;
    double burstDeviationK;
    int burstMinHistory;
    int burstHistorySize;
    int retentionDays;
    long knownAfterOccurrences;
    long knownAfterAgeHours;
    int sampleEventLimit;
    Set<DetectionRuleType> enabledRules;

    public boolean isEnabled(DetectionRuleType rule) {
        return enabledRules.contains(rule);
    }

    public double floor(double value) {
        return Math.max(value, floorValue);
    }

    /**
     * @return human readable violations, empty when the config is usable
     */
    public List<String> violations() {
        List<String> errors = new ArrayList<>();
        if (zoneId == null) errors.add("zoneId is required");
        if (!(ratioThreshold > 0)) errors.add("ratioThreshold must be > 0");
        if (!(baselineMultiplier > 0)) errors.add("baselineMultiplier must be > 0");
        if (!(largeBaselineMean > 0)) errors.add("largeBaselineMean must be > 0");
        if (minimumSupportCount < 1) errors.add("minimumSupportCount must be >= 1");
        if (absoluteFloorValue < 0) errors.add("absoluteFloorValue must be >= 0");
        if (!(floorValue > 0)) errors.add("floorValue must be > 0");
        if (sameDayWindowCount < 1 || sameDayWindowCount > 6) errors.add("sameDayWindowCount must be in [1..6]");
        if (!(burstDeviationK > 0)) errors.add("burstDeviationK must be > 0");
        if (burstMinHistory < 1) errors.add("burstMinHistory must be >= 1");
        if (burstHistorySize < burstMinHistory) errors.add("burstHistorySize must be >= burstMinHistory");
        if (retentionDays < 1) errors.add("retentionDays must be >= 1");
        if (knownAfterOccurrences < 1) errors.add("knownAfterOccurrences must be >= 1");
        if (knownAfterAgeHours < 0) errors.add("knownAfterAgeHours must be >= 0");
        if (sampleEventLimit < 1) errors.add("sampleEventLimit must be >= 1");
        if (enabledRules == null || enabledRules.isEmpty()) errors.add("at least one rule must be enabled");
        return errors;
    }
}
