package com.company.anomaly.service;

import com.company.anomaly.domain.InvestigationRecord;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.domain.enums.InvestigationStatus;
import com.company.anomaly.exception.InvalidStatusTransitionException;
import com.company.anomaly.exception.InvestigationNotFoundException;
import com.company.anomaly.repository.InvestigationRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Human-driven lifecycle of investigation records. Status only moves forward and
 * records are never deleted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InvestigationService {

    private final InvestigationRepository investigationRepository;
    private final MeterRegistry meterRegistry;

    public InvestigationRecord acknowledge(Long investigationId, String notes) {
        return transition(investigationId, InvestigationStatus.ACKNOWLEDGED, notes);
    }

    public InvestigationRecord resolve(Long investigationId, String notes) {
        return transition(investigationId, InvestigationStatus.RESOLVED, notes);
    }

    public InvestigationRecord get(Long investigationId) {
        return investigationRepository.findById(investigationId)
                .orElseThrow(() -> new InvestigationNotFoundException(investigationId));
    }

    public List<InvestigationRecord> findBySlot(TimeSlot slot, int limit) {
        return investigationRepository.findBySlot(slot, limit);
    }

    public List<InvestigationRecord> findBetween(Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("from must be before to");
        }
        return investigationRepository.findBetween(from, to);
    }

    public List<InvestigationRecord> findByProblemKey(String problemKey, int limit) {
        return investigationRepository.findByProblemKey(problemKey, limit);
    }

    private InvestigationRecord transition(Long investigationId, InvestigationStatus target, String notes) {
        InvestigationRecord record = get(investigationId);
        InvestigationStatus current = record.getStatus();

        if (!current.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(investigationId, current, target);
        }

        if (!investigationRepository.updateStatus(investigationId, current, target, notes)) {
            // someone else moved it in between
            InvestigationStatus now = get(investigationId).getStatus();
            throw new InvalidStatusTransitionException(investigationId, now, target);
        }

        log.info("Investigation {} moved {} -> {}", investigationId, current, target);
        meterRegistry.counter("anomaly.investigations.transitions", "status", target.name()).increment();
        return get(investigationId);
    }
}
