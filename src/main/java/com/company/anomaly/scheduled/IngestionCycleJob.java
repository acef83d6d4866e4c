package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.CycleRun;
import com.company.anomaly.domain.enums.CycleStatus;
import com.company.anomaly.repository.CycleRunRepository;
import com.company.anomaly.service.IngestionCycleService;
import com.company.anomaly.service.LogSourceGateway;
import com.company.anomaly.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the ingestion cycle for the last closed quarter hour. Windows that aborted
 * recently are retried first, oldest first.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "anomaly.ingestion.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class IngestionCycleJob {

    private final IngestionCycleService cycleService;
    private final LogSourceGateway logSource;
    private final CycleRunRepository cycleRunRepository;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${anomaly.ingestion.cron:0 2/15 * * * *}")
    public void runScheduledCycle() {
        if (!logSource.isAvailable()) {
            log.warn("No ErrorLogSource configured, ingestion cycle skipped");
            meterRegistry.counter("anomaly.cycles.skipped", "reason", "no_source").increment();
            return;
        }

        Instant current = TimeUtils.lastCompleteWindowStart(Instant.now());

        int succeeded = 0;
        int failed = 0;
        for (Instant windowStart : windowsToRun(current)) {
            try {
                cycleService.runCycle(windowStart);
                succeeded++;
            } catch (Exception e) {
                // already logged and recorded as ABORTED, picked up again next run
                failed++;
                meterRegistry.counter("anomaly.cycles.failed").increment();
            }
        }

        if (failed > 0) {
            log.warn("Ingestion run finished: {} windows succeeded, {} failed", succeeded, failed);
        } else {
            log.debug("Ingestion run finished: {} windows succeeded", succeeded);
        }
    }

    List<Instant> windowsToRun(Instant current) {
        int retryWindows = properties.getIngestion().getRetryWindows();
        Instant retryFrom = TimeUtils.windowsBefore(current, retryWindows);

        List<Instant> windows = cycleRunRepository.findBetween(retryFrom, current).stream()
                .filter(run -> run.getStatus() == CycleStatus.ABORTED)
                .map(CycleRun::getWindowStart)
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toCollection(ArrayList::new));

        if (!windows.isEmpty()) {
            log.info("Retrying {} aborted windows: {}", windows.size(), windows);
        }
        windows.add(current);
        return windows;
    }
}
