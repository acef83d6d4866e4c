package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.exception.FetchException;
import com.company.anomaly.source.Fingerprint;
import com.company.anomaly.source.FingerprintExtractor;
import com.company.anomaly.source.LogEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the error signature of an anomalous slot from a sample of its raw events.
 * Failures stay local to the slot: the signature falls back to {@code unclassified}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InvestigationEnricher {

    private final LogSourceGateway logSource;
    private final ObjectProvider<FingerprintExtractor> fingerprintExtractor;
    private final ErrorClassifier errorClassifier;

    public String signatureFor(String categoryKey, Instant windowStart, Instant windowEnd, DetectionConfig config) {
        List<LogEvent> events;
        try {
            events = logSource.fetchEvents(categoryKey, windowStart, windowEnd, config.getSampleEventLimit());
        } catch (FetchException e) {
            log.warn("Could not sample events of {} for window {}, signature left unclassified: {}",
                    categoryKey, windowStart, e.getMessage());
            return ErrorClassifier.UNCLASSIFIED;
        }

        if (events.isEmpty()) {
            return ErrorClassifier.UNCLASSIFIED;
        }

        FingerprintExtractor extractor = fingerprintExtractor.getIfAvailable();
        Map<String, Integer> signatureCounts = new TreeMap<>();
        int failedFingerprints = 0;

        for (LogEvent event : events) {
            String errorType = null;
            if (extractor != null) {
                try {
                    Fingerprint fingerprint = extractor.fingerprint(event.getMessage());
                    errorType = fingerprint != null ? fingerprint.getErrorType() : null;
                } catch (RuntimeException e) {
                    failedFingerprints++;
                }
            }
            signatureCounts.merge(errorClassifier.classify(errorType, event.getMessage()), 1, Integer::sum);
        }

        if (failedFingerprints > 0) {
            log.warn("Fingerprinting failed for {} of {} sampled events of {}",
                    failedFingerprints, events.size(), categoryKey);
        }

        // most frequent wins, ties go to the alphabetically first signature
        return signatureCounts.entrySet().stream()
                .max(Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElse(ErrorClassifier.UNCLASSIFIED);
    }
}
