package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.*;
import com.company.anomaly.domain.enums.CycleStatus;
import com.company.anomaly.domain.enums.InvestigationStatus;
import com.company.anomaly.domain.enums.ReviewStatus;
import com.company.anomaly.exception.CycleAlreadyCompletedException;
import com.company.anomaly.repository.BaselineStore;
import com.company.anomaly.repository.CycleRunRepository;
import com.company.anomaly.repository.InvestigationRepository;
import com.company.anomaly.repository.RegistryReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Applies a planned cycle in one transaction. Either every write of the window lands
 * or none does.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CycleCommitter {

    static final double MAX_STORED_RATIO = 999.0;

    private static final int SAMPLE_WEIGHT = 1;

    private final BaselineStore baselineStore;
    private final InvestigationRepository investigationRepository;
    private final RegistryReviewRepository reviewRepository;
    private final ProblemRegistry problemRegistry;
    private final CycleRunRepository cycleRunRepository;

    @Transactional
    public CommitResult commit(CyclePlan plan, DetectionConfig config) {
        Instant windowStart = plan.getWindowStart();

        if (!cycleRunRepository.claim(windowStart, plan.getWindowEnd(), plan.getCycleId(), plan.getStartedAt())) {
            throw new CycleAlreadyCompletedException(windowStart);
        }

        for (SlotDecision decision : plan.getDecisions()) {
            TimeSlot slot = decision.getObservation().getSlot();
            baselineStore.upsert(slot, decision.getReplacementValue(), SAMPLE_WEIGHT, windowStart);
            baselineStore.appendSample(slot, windowStart, decision.getReplacementValue());
        }

        int placeholders = baselineStore.ensureGridComplete(
                plan.getGridSlots(), config.getSameDayWindowCount(), windowStart);

        int investigations = 0;
        int reviewItems = 0;
        int promoted = 0;

        for (SlotDecision decision : plan.getDecisions()) {
            if (!decision.isAnomalous()) {
                continue;
            }

            if (investigationRepository.insertIfAbsent(toInvestigation(decision)).isPresent()) {
                investigations++;
            }

            if (decision.needsReview() && reviewRepository.saveIfAbsent(toReviewItem(decision, windowStart))) {
                reviewItems++;
            }

            ProblemRegistryEntry entry = problemRegistry.record(decision.getProblemKey(), windowStart, config);
            if (entry.isKnown() && !decision.isKnownProblem()) {
                promoted++;
            }
        }

        long anomalies = plan.anomalyCount();
        long known = plan.knownAnomalyCount();
        cycleRunRepository.complete(CycleRun.builder()
                .windowStart(windowStart)
                .windowEnd(plan.getWindowEnd())
                .cycleId(plan.getCycleId())
                .status(CycleStatus.COMPLETED)
                .observations(plan.getDecisions().size())
                .skippedCategories(plan.getSkippedCategories().size())
                .anomalies((int) anomalies)
                .knownAnomalies((int) known)
                .newAnomalies((int) (anomalies - known))
                .totalHits(plan.getTotalHits())
                .returnedHits(plan.getReturnedHits())
                .startedAt(plan.getStartedAt())
                .completedAt(Instant.now())
                .build());

        return CommitResult.builder()
                .baselineUpdates(plan.getDecisions().size())
                .placeholdersInserted(placeholders)
                .investigationsCreated(investigations)
                .reviewItemsFiled(reviewItems)
                .problemsPromoted(promoted)
                .gridCompletenessPercent(baselineStore.gridCompleteness())
                .build();
    }

    private static InvestigationRecord toInvestigation(SlotDecision decision) {
        Observation observation = decision.getObservation();
        Detection detection = decision.getDetection();
        Reference reference = decision.getReference();

        return InvestigationRecord.builder()
                .slot(observation.getSlot())
                .windowStart(observation.getWindowStart())
                .originalValue(observation.getRawCount())
                .referenceValue(reference != null ? reference.getValue() : null)
                .replacementValue(decision.getReplacementValue())
                .ratio(detection.getRatio() != null ? Math.min(detection.getRatio(), MAX_STORED_RATIO) : null)
                .state(detection.getState())
                .evidence(detection.getEvidence())
                .problemKey(decision.getProblemKey().asString())
                .knownProblem(decision.isKnownProblem())
                .status(InvestigationStatus.NEW)
                .build();
    }

    private static RegistryReviewItem toReviewItem(SlotDecision decision, Instant windowStart) {
        return RegistryReviewItem.builder()
                .problemKey(decision.getProblemKey().asString())
                .candidateKeys(decision.getReviewCandidates())
                .reason("fuzzy match against " + decision.getReviewCandidates().size() + " registry entries")
                .windowStart(windowStart)
                .status(ReviewStatus.OPEN)
                .build();
    }
}
