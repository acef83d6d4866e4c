package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.config.DetectionConfigFixtures;
import com.company.anomaly.exception.FetchException;
import com.company.anomaly.source.Fingerprint;
import com.company.anomaly.source.FingerprintExtractor;
import com.company.anomaly.source.LogEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvestigationEnricherTest {

    private static final Instant START = Instant.parse("2024-01-08T09:00:00Z");
    private static final Instant END = Instant.parse("2024-01-08T09:15:00Z");

    @Mock
    private LogSourceGateway logSource;

    @Mock
    private ObjectProvider<FingerprintExtractor> extractorProvider;

    @Mock
    private FingerprintExtractor extractor;

    private final DetectionConfig config = DetectionConfigFixtures.defaults();

    private InvestigationEnricher enricher;

    @BeforeEach
    void setUp() {
        enricher = new InvestigationEnricher(logSource, extractorProvider, new ErrorClassifier());
    }

    @Test
    void mostFrequentSignatureWins() {
        when(logSource.fetchEvents("checkout-api", START, END, 200)).thenReturn(List.of(
                event("Read timed out"),
                event("Read timed out"),
                event("NullPointerException at CartService.total")));
        when(extractorProvider.getIfAvailable()).thenReturn(null);

        assertThat(enricher.signatureFor("checkout-api", START, END, config)).isEqualTo("timeout");
    }

    @Test
    void tiesGoToAlphabeticallyFirstSignature() {
        when(logSource.fetchEvents("checkout-api", START, END, 200)).thenReturn(List.of(
                event("Read timed out"),
                event("Connection refused")));
        when(extractorProvider.getIfAvailable()).thenReturn(null);

        assertThat(enricher.signatureFor("checkout-api", START, END, config)).isEqualTo("connection_error");
    }

    @Test
    void fingerprintErrorTypeFeedsClassification() {
        when(logSource.fetchEvents("checkout-api", START, END, 200)).thenReturn(List.of(
                event("card 4111 declined for order 991")));
        when(extractorProvider.getIfAvailable()).thenReturn(extractor);
        when(extractor.fingerprint(anyString())).thenReturn(Fingerprint.of("fp-1", "PaymentDeclinedError"));

        assertThat(enricher.signatureFor("checkout-api", START, END, config)).isEqualTo("payment_declined_error");
    }

    @Test
    void failingFingerprintFallsBackToMessage() {
        when(logSource.fetchEvents("checkout-api", START, END, 200)).thenReturn(List.of(
                event("Read timed out")));
        when(extractorProvider.getIfAvailable()).thenReturn(extractor);
        when(extractor.fingerprint(anyString())).thenThrow(new IllegalStateException("parser broke"));

        assertThat(enricher.signatureFor("checkout-api", START, END, config)).isEqualTo("timeout");
    }

    @Test
    void fetchFailureLeavesSlotUnclassified() {
        when(logSource.fetchEvents("checkout-api", START, END, 200))
                .thenThrow(new FetchException("log store unavailable"));

        assertThat(enricher.signatureFor("checkout-api", START, END, config))
                .isEqualTo(ErrorClassifier.UNCLASSIFIED);
        verifyNoInteractions(extractorProvider);
    }

    private static LogEvent event(String message) {
        return LogEvent.of(START.plusSeconds(30), "checkout-api", message);
    }
}
