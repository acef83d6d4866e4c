package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.ProblemKey;
import com.company.anomaly.domain.ProblemRegistryEntry;
import com.company.anomaly.domain.RegistryClassification;
import com.company.anomaly.domain.RegistryReviewItem;
import com.company.anomaly.exception.ProblemNotFoundException;
import com.company.anomaly.exception.RegistryAmbiguityException;
import com.company.anomaly.repository.ProblemRegistryRepository;
import com.company.anomaly.repository.RegistryReviewRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Known/new identity of recurring anomalies.
 * <p>
 * Exact key match decides. Entries of the same category and detection type with another
 * signature are only reported as similar; they are never merged. More than one of them
 * without an exact match is ambiguous and goes to manual review.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProblemRegistry {

    private final ProblemRegistryRepository registryRepository;
    private final RegistryReviewRepository reviewRepository;
    private final KnownProblemPolicy knownProblemPolicy;
    private final MeterRegistry meterRegistry;

    /**
     * @throws RegistryAmbiguityException when there is no exact entry and several fuzzy candidates
     */
    public RegistryClassification classify(ProblemKey key) {
        Optional<ProblemRegistryEntry> exact = registryRepository.findByKey(key.asString());
        List<String> similar = registryRepository.findSimilar(key).stream()
                .map(ProblemRegistryEntry::getProblemKey)
                .collect(Collectors.toList());

        if (exact.isPresent()) {
            return RegistryClassification.builder()
                    .known(exact.get().isKnown())
                    .entry(exact.get())
                    .similarKeys(similar)
                    .build();
        }

        if (similar.size() > 1) {
            meterRegistry.counter("anomaly.registry.ambiguous").increment();
            throw new RegistryAmbiguityException(key.asString(), similar);
        }
        return RegistryClassification.unknown(similar);
    }

    /**
     * Count one occurrence and promote the entry when the policy says so
     */
    public ProblemRegistryEntry record(ProblemKey key, Instant seenAt, DetectionConfig config) {
        ProblemRegistryEntry entry = registryRepository.recordOccurrence(key, seenAt);

        if (entry.getOccurrenceCount() == 1) {
            log.info("New problem registered: {}", key);
            meterRegistry.counter("anomaly.registry.created").increment();
        }

        if (!entry.isKnown() && knownProblemPolicy.isKnown(entry, config)) {
            entry = registryRepository.markKnown(entry.getProblemKey()).orElse(entry);
            log.info("Problem {} is now known after {} occurrences", key, entry.getOccurrenceCount());
            meterRegistry.counter("anomaly.registry.promoted").increment();
        }
        return entry;
    }

    public ProblemRegistryEntry promote(String problemKey) {
        ProblemRegistryEntry entry = registryRepository.markKnown(problemKey)
                .orElseThrow(() -> new ProblemNotFoundException(problemKey));
        log.info("Problem {} promoted to known by operator", problemKey);
        return entry;
    }

    /**
     * Explicit action only; nothing demotes automatically
     */
    public ProblemRegistryEntry demote(String problemKey) {
        ProblemRegistryEntry entry = registryRepository.demote(problemKey)
                .orElseThrow(() -> new ProblemNotFoundException(problemKey));
        log.info("Problem {} demoted to new at {} occurrences", problemKey, entry.getOccurrenceCount());
        meterRegistry.counter("anomaly.registry.demoted").increment();
        return entry;
    }

    public ProblemRegistryEntry get(String problemKey) {
        return registryRepository.findByKey(problemKey)
                .orElseThrow(() -> new ProblemNotFoundException(problemKey));
    }

    public List<ProblemRegistryEntry> findSeenBetween(Instant from, Instant to) {
        return registryRepository.findSeenBetween(from, to);
    }

    public List<ProblemRegistryEntry> findByCategory(String categoryKey) {
        return registryRepository.findByCategory(categoryKey);
    }

    public List<RegistryReviewItem> openReviewItems(int limit) {
        return reviewRepository.findOpen(limit);
    }

    public boolean closeReviewItem(Long reviewId) {
        boolean closed = reviewRepository.close(reviewId);
        if (closed) {
            log.info("Registry review item {} closed", reviewId);
        }
        return closed;
    }
}
