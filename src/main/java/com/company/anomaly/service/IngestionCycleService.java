package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.config.DetectionConfigProvider;
import com.company.anomaly.detection.AnomalyDetector;
import com.company.anomaly.detection.RuleInput;
import com.company.anomaly.domain.*;
import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.CycleMode;
import com.company.anomaly.event.CycleCompletedEvent;
import com.company.anomaly.event.CycleFailedEvent;
import com.company.anomaly.exception.CycleAlreadyCompletedException;
import com.company.anomaly.exception.RegistryAmbiguityException;
import com.company.anomaly.exception.StoreException;
import com.company.anomaly.repository.CycleRunRepository;
import com.company.anomaly.source.CountBatch;
import com.company.anomaly.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * One batch window end to end.
 * <p>
 * Everything up to the commit is read-only: counts are fetched, validated and judged
 * against a single snapshot of the baseline. {@link CycleCommitter} then applies the
 * whole plan in one transaction. Shared infrastructure failures abort the cycle with
 * nothing applied; bad data of one category only skips that category.
 * <p>
 * A {@link CycleMode#LEARN} cycle runs the same fetch and commit but skips detection, so a
 * fresh deployment can build its baseline from history before anything is judged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionCycleService {

    private static final String MDC_CYCLE_ID_KEY = "cycleId";

    private final DetectionConfigProvider configProvider;
    private final LogSourceGateway logSource;
    private final ObservationValidator validator;
    private final SnapshotLoader snapshotLoader;
    private final ReferenceResolver referenceResolver;
    private final AnomalyDetector detector;
    private final PeakReplacement peakReplacement;
    private final InvestigationEnricher enricher;
    private final ProblemRegistry problemRegistry;
    private final CycleCommitter committer;
    private final CycleRunRepository cycleRunRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public CycleSummary runCycle(Instant windowStart) {
        return runCycle(windowStart, CycleMode.DETECT);
    }

    public CycleSummary runCycle(Instant windowStart, CycleMode mode) {
        if (!TimeUtils.isAligned(windowStart)) {
            throw new IllegalArgumentException("Window start must be aligned to a quarter hour: " + windowStart);
        }

        String cycleId = UUID.randomUUID().toString();
        Instant windowEnd = TimeUtils.windowEnd(windowStart);
        Instant startedAt = Instant.now();
        Timer.Sample timer = Timer.start(meterRegistry);

        MDC.put(MDC_CYCLE_ID_KEY, cycleId);
        try {
            if (cycleRunRepository.isCompleted(windowStart)) {
                log.info("Window {} already committed, skipping", windowStart);
                return alreadyProcessed(cycleId, windowStart, windowEnd);
            }

            log.info("Starting {} cycle for window {} - {}", mode, windowStart, windowEnd);

            DetectionConfig config = configProvider.current();
            CyclePlan plan = plan(cycleId, windowStart, windowEnd, startedAt, config, mode);
            CommitResult result = committer.commit(plan, config);
            CycleSummary summary = summarize(plan, result, startedAt);

            log.info("Cycle for window {} committed: {} observations, {} anomalies ({} known, {} new), "
                            + "{} categories skipped, {} placeholders, grid {}% complete",
                    windowStart, summary.getObservations(), summary.getAnomalies(), summary.getKnownAnomalies(),
                    summary.getNewAnomalies(), summary.getSkippedCategories().size(),
                    summary.getPlaceholdersInserted(), String.format("%.1f", summary.getGridCompletenessPercent()));

            meterRegistry.counter("anomaly.cycles.completed", "mode", mode.name()).increment();
            if (mode == CycleMode.LEARN) {
                return summary;
            }

            meterRegistry.counter("anomaly.anomalies.detected", "registry", "known").increment(summary.getKnownAnomalies());
            meterRegistry.counter("anomaly.anomalies.detected", "registry", "new").increment(summary.getNewAnomalies());

            eventPublisher.publishEvent(new CycleCompletedEvent(summary));
            return summary;

        } catch (CycleAlreadyCompletedException e) {
            log.info("Window {} was committed by an overlapping run, nothing applied", windowStart);
            meterRegistry.counter("anomaly.cycles.duplicate").increment();
            return alreadyProcessed(cycleId, windowStart, windowEnd);
        } catch (RuntimeException e) {
            abort(cycleId, windowStart, windowEnd, e);
            throw e;
        } finally {
            timer.stop(meterRegistry.timer("anomaly.cycle.duration"));
            MDC.remove(MDC_CYCLE_ID_KEY);
        }
    }

    CyclePlan plan(String cycleId, Instant windowStart, Instant windowEnd, Instant startedAt,
                   DetectionConfig config, CycleMode mode) {
        CountBatch batch = logSource.fetchCounts(windowStart, windowEnd);
        ValidatedBatch validated = validator.validate(batch, windowStart, config.getZoneId());

        if (!validated.getSkippedCategories().isEmpty()) {
            log.warn("Window {}: {} categories skipped for data quality: {}",
                    windowStart, validated.getSkippedCategories().size(), validated.getSkippedCategories());
        }

        BaselineSnapshot snapshot = snapshotLoader.load(validated.getObservations(), windowStart, config);

        List<SlotDecision> decisions = new ArrayList<>(validated.getObservations().size());
        for (Observation observation : validated.getObservations()) {
            decisions.add(mode == CycleMode.LEARN
                    ? learn(observation)
                    : decide(observation, snapshot, windowEnd, config));
        }

        return CyclePlan.builder()
                .cycleId(cycleId)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .startedAt(startedAt)
                .decisions(decisions)
                .gridSlots(gridSlots(validated, snapshot, windowStart, config))
                .skippedCategories(validated.getSkippedCategories())
                .totalHits(batch.getTotalHits())
                .returnedHits(batch.getReturnedHits())
                .build();
    }

    SlotDecision decide(Observation observation, BaselineSnapshot snapshot, Instant windowEnd, DetectionConfig config) {
        TimeSlot slot = observation.getSlot();
        Instant windowStart = observation.getWindowStart();

        Optional<Reference> reference = referenceResolver.resolve(slot, windowStart, snapshot, config);
        RuleInput input = RuleInput.builder()
                .observation(observation)
                .reference(reference.orElse(null))
                .history(snapshot.history(slot, windowStart, config.getBurstHistorySize()))
                .build();

        Detection detection = detector.detect(input, config);
        double replacement = peakReplacement.valueToWrite(observation, reference, detection);
        SlotDecision.SlotDecisionBuilder decision = SlotDecision.builder()
                .observation(observation)
                .reference(reference.orElse(null))
                .detection(detection)
                .replacementValue(replacement);

        if (!detection.isAnomalous()) {
            return decision.build();
        }

        String signature = enricher.signatureFor(slot.getCategoryKey(), windowStart, windowEnd, config);
        ProblemKey problemKey = ProblemKey.of(slot.getCategoryKey(), signature, detection.getState().getDetectionType());
        decision.problemKey(problemKey);

        try {
            RegistryClassification classification = problemRegistry.classify(problemKey);
            decision.knownProblem(classification.isKnown());
        } catch (RegistryAmbiguityException e) {
            log.warn("{}; filed for manual review and treated as new", e.getMessage());
            decision.knownProblem(false).reviewCandidates(e.getCandidateKeys());
        }

        log.info("Anomaly {} in {}: observed {}, reference {}, writing {} to baseline [{}]",
                detection.getState(), slot, observation.getRawCount(),
                reference.map(r -> String.format("%.2f", r.getValue())).orElse("none"),
                String.format("%.2f", replacement), problemKey);
        return decision.build();
    }

    private static SlotDecision learn(Observation observation) {
        return SlotDecision.builder()
                .observation(observation)
                .detection(Detection.builder().state(AnomalyState.NORMAL).build())
                .replacementValue(observation.getRawCount())
                .build();
    }

    /**
     * Observed slots plus the current period of every category already on the grid,
     * so categories that went quiet in this window keep a complete grid too
     */
    private static List<TimeSlot> gridSlots(ValidatedBatch validated, BaselineSnapshot snapshot,
                                            Instant windowStart, DetectionConfig config) {
        Set<TimeSlot> slots = new LinkedHashSet<>();
        validated.getObservations().forEach(o -> slots.add(o.getSlot()));

        PeriodOfWeek current = PeriodOfWeek.at(windowStart, config.getZoneId());
        for (String category : snapshot.getKnownCategories()) {
            if (!validated.getSkippedCategories().containsKey(category)) {
                slots.add(TimeSlot.of(category, current));
            }
        }
        return new ArrayList<>(slots);
    }

    private static CycleSummary summarize(CyclePlan plan, CommitResult result, Instant startedAt) {
        int anomalies = (int) plan.anomalyCount();
        int known = (int) plan.knownAnomalyCount();

        return CycleSummary.builder()
                .cycleId(plan.getCycleId())
                .windowStart(plan.getWindowStart())
                .windowEnd(plan.getWindowEnd())
                .observations(plan.getDecisions().size())
                .skippedCategories(plan.getSkippedCategories())
                .anomalies(anomalies)
                .knownAnomalies(known)
                .newAnomalies(anomalies - known)
                .reviewItems(result.getReviewItemsFiled())
                .placeholdersInserted(result.getPlaceholdersInserted())
                .gridCompletenessPercent(result.getGridCompletenessPercent())
                .totalHits(plan.getTotalHits())
                .returnedHits(plan.getReturnedHits())
                .durationMs(Duration.between(startedAt, Instant.now()).toMillis())
                .alreadyProcessed(false)
                .build();
    }

    private static CycleSummary alreadyProcessed(String cycleId, Instant windowStart, Instant windowEnd) {
        return CycleSummary.builder()
                .cycleId(cycleId)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .skippedCategories(Map.of())
                .alreadyProcessed(true)
                .build();
    }

    private void abort(String cycleId, Instant windowStart, Instant windowEnd, RuntimeException e) {
        String errorType = e.getClass().getSimpleName();
        String reason = errorType + ": " + e.getMessage();

        log.error("Cycle aborted for window {}, nothing applied: {}", windowStart, reason, e);
        meterRegistry.counter("anomaly.cycles.aborted", "error", errorType).increment();

        try {
            cycleRunRepository.markAborted(windowStart, windowEnd, cycleId, reason);
        } catch (StoreException storeFailure) {
            log.error("Could not record abort of window {} in the ledger", windowStart, storeFailure);
        }

        eventPublisher.publishEvent(new CycleFailedEvent(cycleId, windowStart, errorType, reason));
    }
}
