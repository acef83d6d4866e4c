package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.config.DetectionConfigFixtures;
import com.company.anomaly.domain.ProblemKey;
import com.company.anomaly.domain.ProblemRegistryEntry;
import com.company.anomaly.domain.RegistryClassification;
import com.company.anomaly.exception.ProblemNotFoundException;
import com.company.anomaly.exception.RegistryAmbiguityException;
import com.company.anomaly.repository.ProblemRegistryRepository;
import com.company.anomaly.repository.RegistryReviewRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProblemRegistryTest {

    private static final ProblemKey KEY = ProblemKey.of("checkout-api", "timeout", "spike");
    private static final Instant SEEN_AT = Instant.parse("2024-01-08T09:00:00Z");

    @Mock
    private ProblemRegistryRepository registryRepository;

    @Mock
    private RegistryReviewRepository reviewRepository;

    private final DetectionConfig config = DetectionConfigFixtures.defaults();

    private ProblemRegistry problemRegistry;

    @BeforeEach
    void setUp() {
        problemRegistry = new ProblemRegistry(registryRepository, reviewRepository,
                new KnownProblemPolicy(), new SimpleMeterRegistry());
    }

    @Test
    void exactMatchDecides() {
        when(registryRepository.findByKey(KEY.asString())).thenReturn(Optional.of(entry(KEY.asString(), 4, true)));
        when(registryRepository.findSimilar(KEY)).thenReturn(List.of(
                entry("checkout-api:null_pointer:spike", 1, false),
                entry("checkout-api:database_error:spike", 1, false)));

        RegistryClassification classification = problemRegistry.classify(KEY);

        assertThat(classification.isKnown()).isTrue();
        assertThat(classification.entry()).isPresent();
        assertThat(classification.getSimilarKeys()).hasSize(2);
    }

    @Test
    void singleSimilarEntryIsReportedButNotMerged() {
        when(registryRepository.findByKey(KEY.asString())).thenReturn(Optional.empty());
        when(registryRepository.findSimilar(KEY)).thenReturn(List.of(entry("checkout-api:io_error:spike", 9, true)));

        RegistryClassification classification = problemRegistry.classify(KEY);

        assertThat(classification.isKnown()).isFalse();
        assertThat(classification.entry()).isEmpty();
        assertThat(classification.getSimilarKeys()).containsExactly("checkout-api:io_error:spike");
    }

    @Test
    void severalSimilarEntriesWithoutExactMatchAreAmbiguous() {
        when(registryRepository.findByKey(KEY.asString())).thenReturn(Optional.empty());
        when(registryRepository.findSimilar(KEY)).thenReturn(List.of(
                entry("checkout-api:io_error:spike", 9, true),
                entry("checkout-api:null_pointer:spike", 2, false)));

        assertThatThrownBy(() -> problemRegistry.classify(KEY))
                .isInstanceOf(RegistryAmbiguityException.class)
                .satisfies(e -> assertThat(((RegistryAmbiguityException) e).getCandidateKeys())
                        .containsExactly("checkout-api:io_error:spike", "checkout-api:null_pointer:spike"));
    }

    @Test
    void recordPromotesOnceThresholdIsReached() {
        when(registryRepository.recordOccurrence(KEY, SEEN_AT)).thenReturn(entry(KEY.asString(), 3, false));
        when(registryRepository.markKnown(KEY.asString())).thenReturn(Optional.of(entry(KEY.asString(), 3, true)));

        ProblemRegistryEntry recorded = problemRegistry.record(KEY, SEEN_AT, config);

        assertThat(recorded.isKnown()).isTrue();
        verify(registryRepository).markKnown(KEY.asString());
    }

    @Test
    void recordBelowThresholdStaysNew() {
        when(registryRepository.recordOccurrence(KEY, SEEN_AT)).thenReturn(entry(KEY.asString(), 2, false));

        ProblemRegistryEntry recorded = problemRegistry.record(KEY, SEEN_AT, config);

        assertThat(recorded.isKnown()).isFalse();
        verify(registryRepository, never()).markKnown(anyString());
    }

    @Test
    void demotedEntryIsNotPromotedWithoutFreshSupport() {
        ProblemRegistryEntry demoted = entry(KEY.asString(), 5, false);
        demoted.setDemotedAtCount(4);
        when(registryRepository.recordOccurrence(KEY, SEEN_AT)).thenReturn(demoted);

        assertThat(problemRegistry.record(KEY, SEEN_AT, config).isKnown()).isFalse();
        verify(registryRepository, never()).markKnown(anyString());
    }

    @Test
    void demotingUnknownProblemFails() {
        when(registryRepository.demote("missing:timeout:spike")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> problemRegistry.demote("missing:timeout:spike"))
                .isInstanceOf(ProblemNotFoundException.class);
    }

    @Test
    void operatorPromotionMarksEntryKnown() {
        when(registryRepository.markKnown(KEY.asString())).thenReturn(Optional.of(entry(KEY.asString(), 1, true)));

        ProblemRegistryEntry promoted = problemRegistry.promote(KEY.asString());

        assertThat(promoted.isKnown()).isTrue();
        assertThat(promoted.getOccurrenceCount()).isEqualTo(1);
    }

    @Test
    void promotingUnknownProblemFails() {
        when(registryRepository.markKnown("missing:timeout:spike")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> problemRegistry.promote("missing:timeout:spike"))
                .isInstanceOf(ProblemNotFoundException.class);
    }

    @Test
    void closingReviewItemReportsWhetherItWasOpen() {
        when(reviewRepository.close(7L)).thenReturn(true);
        when(reviewRepository.close(8L)).thenReturn(false);

        assertThat(problemRegistry.closeReviewItem(7L)).isTrue();
        assertThat(problemRegistry.closeReviewItem(8L)).isFalse();
        verify(reviewRepository).close(7L);
        verify(reviewRepository).close(8L);
    }

    private static ProblemRegistryEntry entry(String problemKey, long occurrences, boolean known) {
        ProblemKey key = ProblemKey.parse(problemKey);
        return ProblemRegistryEntry.builder()
                .problemKey(problemKey)
                .categoryKey(key.getCategoryKey())
                .signature(key.getSignature())
                .detectionType(key.getDetectionType())
                .firstSeen(SEEN_AT)
                .lastSeen(SEEN_AT)
                .occurrenceCount(occurrences)
                .known(known)
                .build();
    }
}
