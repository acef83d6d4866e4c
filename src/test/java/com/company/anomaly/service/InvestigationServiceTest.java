package com.company.anomaly.service;

import com.company.anomaly.domain.InvestigationRecord;
import com.company.anomaly.domain.PeriodOfWeek;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.InvestigationStatus;
import com.company.anomaly.exception.InvalidStatusTransitionException;
import com.company.anomaly.exception.InvestigationNotFoundException;
import com.company.anomaly.repository.InvestigationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvestigationServiceTest {

    @Mock
    private InvestigationRepository investigationRepository;

    private InvestigationService investigationService;

    @BeforeEach
    void setUp() {
        investigationService = new InvestigationService(investigationRepository, new SimpleMeterRegistry());
    }

    @Test
    void acknowledgeMovesNewForward() {
        when(investigationRepository.findById(7L)).thenReturn(
                Optional.of(record(InvestigationStatus.NEW)),
                Optional.of(record(InvestigationStatus.ACKNOWLEDGED)));
        when(investigationRepository.updateStatus(7L, InvestigationStatus.NEW,
                InvestigationStatus.ACKNOWLEDGED, "looking")).thenReturn(true);

        InvestigationRecord updated = investigationService.acknowledge(7L, "looking");

        assertThat(updated.getStatus()).isEqualTo(InvestigationStatus.ACKNOWLEDGED);
        verify(investigationRepository).updateStatus(7L, InvestigationStatus.NEW,
                InvestigationStatus.ACKNOWLEDGED, "looking");
    }

    @Test
    void resolvedInvestigationCannotGoBack() {
        when(investigationRepository.findById(7L)).thenReturn(Optional.of(record(InvestigationStatus.RESOLVED)));

        assertThatThrownBy(() -> investigationService.acknowledge(7L, "reopen"))
                .isInstanceOf(InvalidStatusTransitionException.class);
        verify(investigationRepository, never()).updateStatus(any(), any(), any(), any());
    }

    @Test
    void concurrentTransitionIsDetected() {
        when(investigationRepository.findById(7L)).thenReturn(
                Optional.of(record(InvestigationStatus.ACKNOWLEDGED)),
                Optional.of(record(InvestigationStatus.RESOLVED)));
        when(investigationRepository.updateStatus(7L, InvestigationStatus.ACKNOWLEDGED,
                InvestigationStatus.RESOLVED, "fixed")).thenReturn(false);

        assertThatThrownBy(() -> investigationService.resolve(7L, "fixed"))
                .isInstanceOf(InvalidStatusTransitionException.class);
    }

    @Test
    void unknownInvestigationFails() {
        when(investigationRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> investigationService.get(99L))
                .isInstanceOf(InvestigationNotFoundException.class);
    }

    @Test
    void rangeMustBeOrdered() {
        Instant now = Instant.parse("2024-01-08T09:00:00Z");

        assertThatThrownBy(() -> investigationService.findBetween(now, now))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static InvestigationRecord record(InvestigationStatus status) {
        return InvestigationRecord.builder()
                .investigationId(7L)
                .slot(TimeSlot.of("checkout-api", PeriodOfWeek.of(0, 10, 0)))
                .windowStart(Instant.parse("2024-01-08T09:00:00Z"))
                .originalValue(500)
                .referenceValue(10.0)
                .replacementValue(10.0)
                .ratio(50.0)
                .state(AnomalyState.SPIKE)
                .problemKey("checkout-api:timeout:spike")
                .status(status)
                .build();
    }
}
