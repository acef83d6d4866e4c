package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.BackfillResult;
import com.company.anomaly.domain.CycleSummary;
import com.company.anomaly.domain.enums.CycleMode;
import com.company.anomaly.service.IngestionCycleService;
import com.company.anomaly.service.LogSourceGateway;
import com.company.anomaly.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Walks past windows through the ingestion cycle once the application is up, oldest first.
 * <p>
 * In {@link CycleMode#LEARN} mode this builds the first baseline from history so that a fresh
 * deployment does not start judging against an empty grid. {@link CycleMode#DETECT} replays
 * detection over a range, e.g. after the log source was unreachable for longer than the
 * live job retries. Windows must run in order because each one reads the values written
 * by the windows before it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "anomaly.backfill.enabled",
        havingValue = "true"
)
public class BaselineBackfillJob {

    private static final int WINDOWS_PER_PROGRESS_LOG = 96;

    private final IngestionCycleService cycleService;
    private final LogSourceGateway logSource;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;

    @EventListener(ApplicationReadyEvent.class)
    @Async
    public void runOnStartup() {
        if (!logSource.isAvailable()) {
            log.warn("No ErrorLogSource configured, backfill skipped");
            meterRegistry.counter("anomaly.backfill.skipped", "reason", "no_source").increment();
            return;
        }

        Instant to = resolveTo(Instant.now());
        Instant from = resolveFrom(to);
        backfill(from, to, properties.getBackfill().getMode());
    }

    /**
     * Runs every aligned window starting in {@code [from, to)}. A failed window is recorded
     * as aborted by the cycle itself and the walk continues with the next one.
     */
    public BackfillResult backfill(Instant from, Instant to, CycleMode mode) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("Backfill range must be non-empty: [" + from + ", " + to + ")");
        }

        Instant first = TimeUtils.alignToWindow(from);
        if (first.isBefore(from)) {
            first = first.plus(TimeUtils.WINDOW);
        }

        log.info("Starting {} backfill over [{}, {})", mode, from, to);
        BackfillResult.BackfillResultBuilder result = BackfillResult.builder().mode(mode).from(from).to(to);

        int windows = 0;
        int committed = 0;
        int alreadyProcessed = 0;
        for (Instant windowStart = first; windowStart.isBefore(to); windowStart = TimeUtils.windowEnd(windowStart)) {
            windows++;
            try {
                CycleSummary summary = cycleService.runCycle(windowStart, mode);
                if (summary.isAlreadyProcessed()) {
                    alreadyProcessed++;
                } else {
                    committed++;
                }
            } catch (RuntimeException e) {
                // already logged and recorded as ABORTED by the cycle
                result.failedWindow(windowStart);
                meterRegistry.counter("anomaly.backfill.windows.failed").increment();
            }

            if (windows % WINDOWS_PER_PROGRESS_LOG == 0) {
                log.info("Backfill progress: {} windows done, last {}", windows, windowStart);
            }
        }

        BackfillResult done = result
                .windows(windows)
                .committed(committed)
                .alreadyProcessed(alreadyProcessed)
                .build();

        meterRegistry.counter("anomaly.backfill.windows.committed", "mode", mode.name()).increment(committed);
        if (done.getFailedWindows().isEmpty()) {
            log.info("Backfill finished: {} windows, {} committed, {} already processed",
                    windows, committed, alreadyProcessed);
        } else {
            log.warn("Backfill finished with failures: {} windows, {} committed, {} already processed, "
                            + "{} failed: {}",
                    windows, committed, alreadyProcessed, done.getFailedWindows().size(), done.getFailedWindows());
        }
        return done;
    }

    /**
     * Configured end, or local midnight of today. Never reaches into the window still open at {@code now}.
     */
    Instant resolveTo(Instant now) {
        ZoneId zone = ZoneId.of(properties.getZoneId());
        Instant openWindow = TimeUtils.alignToWindow(now);
        Instant configured = properties.getBackfill().getTo();
        if (configured == null) {
            configured = now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
        }
        return configured.isAfter(openWindow) ? openWindow : configured;
    }

    Instant resolveFrom(Instant to) {
        Instant configured = properties.getBackfill().getFrom();
        if (configured != null) {
            return configured;
        }
        ZoneId zone = ZoneId.of(properties.getZoneId());
        return to.atZone(zone).toLocalDate()
                .minusDays(properties.getBackfill().getDays())
                .atStartOfDay(zone)
                .toInstant();
    }
}
