package com.company.anomaly.config;

import com.company.anomaly.domain.enums.DetectionRuleType;
import com.company.anomaly.repository.DetectionParameterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Builds the {@link DetectionConfig} for a cycle: property defaults overlaid with
 * rows from detection_parameters. Thresholds change between cycles without a restart.
 * An override that does not parse, or leaves the config invalid, is logged and ignored.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DetectionConfigProvider {

    private final AnomalyProperties properties;
    private final DetectionParameterRepository parameterRepository;

    private final AtomicReference<Map<String, String>> lastApplied = new AtomicReference<>(Map.of());

    public DetectionConfig current() {
        DetectionConfig config = defaults();
        Map<String, String> overrides = parameterRepository.findAll();

        for (Map.Entry<String, String> override : overrides.entrySet()) {
            try {
                DetectionConfig candidate = apply(config, override.getKey(), override.getValue());
                List<String> violations = candidate.violations();
                if (!violations.isEmpty()) {
                    log.warn("Ignoring detection parameter {}={}: {}",
                            override.getKey(), override.getValue(), violations);
                    continue;
                }
                config = candidate;
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring detection parameter {}={}: {}",
                        override.getKey(), override.getValue(), e.getMessage());
            }
        }

        Map<String, String> previous = lastApplied.getAndSet(Map.copyOf(overrides));
        if (!Objects.equals(previous, overrides)) {
            log.info("Detection parameter overrides changed: {}", overrides);
        }
        return config;
    }

    DetectionConfig defaults() {
        AnomalyProperties.Detection detection = properties.getDetection();
        AnomalyProperties.Registry registry = properties.getRegistry();

        return DetectionConfig.builder()
                .zoneId(ZoneId.of(properties.getZoneId()))
                .ratioThreshold(detection.getRatioThreshold())
                .baselineMultiplier(detection.getBaselineMultiplier())
                .largeBaselineMean(detection.getLargeBaselineMean())
                .minimumSupportCount(detection.getMinimumSupportCount())
                .absoluteFloorValue(detection.getAbsoluteFloorValue())
                .floorValue(detection.getFloorValue())
                .sameDayWindowCount(detection.getSameDayWindowCount())
                .burstDeviationK(detection.getBurstDeviationK())
                .burstMinHistory(detection.getBurstMinHistory())
                .burstHistorySize(detection.getBurstHistorySize())
                .retentionDays(detection.getRetentionDays())
                .knownAfterOccurrences(registry.getKnownAfterOccurrences())
                .knownAfterAgeHours(registry.getKnownAfterAgeHours())
                .sampleEventLimit(properties.getSource().getSampleEventLimit())
                .enabledRules(Set.copyOf(detection.getEnabledRules()))
                .build();
    }

    private DetectionConfig apply(DetectionConfig config, String name, String rawValue) {
        if (rawValue == null) {
            throw new IllegalArgumentException("value is null");
        }
        String value = rawValue.trim();
        DetectionConfig.DetectionConfigBuilder builder = config.toBuilder();

        switch (name) {
            case "ratioThreshold" -> builder.ratioThreshold(parseDouble(value));
            case "baselineMultiplier" -> builder.baselineMultiplier(parseDouble(value));
            case "largeBaselineMean" -> builder.largeBaselineMean(parseDouble(value));
            case "minimumSupportCount" -> builder.minimumSupportCount(parseLong(value));
            case "absoluteFloorValue" -> builder.absoluteFloorValue(parseLong(value));
            case "floorValue" -> builder.floorValue(parseDouble(value));
            case "sameDayWindowCount" -> builder.sameDayWindowCount(parseInt(value));
            case "burstDeviationK" -> builder.burstDeviationK(parseDouble(value));
            case "burstMinHistory" -> builder.burstMinHistory(parseInt(value));
            case "burstHistorySize" -> builder.burstHistorySize(parseInt(value));
            case "retentionDays" -> builder.retentionDays(parseInt(value));
            case "knownAfterOccurrences" -> builder.knownAfterOccurrences(parseLong(value));
            case "knownAfterAgeHours" -> builder.knownAfterAgeHours(parseLong(value));
            case "enabledRules" -> builder.enabledRules(parseRules(value));
            default -> throw new IllegalArgumentException("unknown parameter");
        }
        return builder.build();
    }

    private static double parseDouble(String value) {
        double parsed = Double.parseDouble(value);
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new IllegalArgumentException("not a finite number");
        }
        return parsed;
    }

    private static long parseLong(String value) {
        return Long.parseLong(value);
    }

    private static int parseInt(String value) {
        return Integer.parseInt(value);
    }

    private static Set<DetectionRuleType> parseRules(String value) {
        if (value.isEmpty()) {
            return EnumSet.noneOf(DetectionRuleType.class);
        }
        return Arrays.stream(value.split(","))
                .map(DetectionRuleType::fromString)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DetectionRuleType.class)));
    }
}
