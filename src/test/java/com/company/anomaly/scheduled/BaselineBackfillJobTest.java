package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.BackfillResult;
import com.company.anomaly.domain.CycleSummary;
import com.company.anomaly.domain.enums.CycleMode;
import com.company.anomaly.exception.FetchException;
import com.company.anomaly.service.IngestionCycleService;
import com.company.anomaly.service.LogSourceGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BaselineBackfillJobTest {

    private static final Instant FROM = Instant.parse("2024-01-08T09:00:00Z");

    @Mock
    private IngestionCycleService cycleService;

    @Mock
    private LogSourceGateway logSource;

    private AnomalyProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private BaselineBackfillJob job;

    @BeforeEach
    void setUp() {
        properties = new AnomalyProperties();
        meterRegistry = new SimpleMeterRegistry();
        job = new BaselineBackfillJob(cycleService, logSource, properties, meterRegistry);
    }

    @Test
    void walksEveryWindowOldestFirstAndKeepsGoingAfterFailure() {
        Instant second = FROM.plusSeconds(900);
        Instant third = FROM.plusSeconds(1800);
        Instant fourth = FROM.plusSeconds(2700);
        when(cycleService.runCycle(FROM, CycleMode.LEARN)).thenReturn(summary(true));
        when(cycleService.runCycle(second, CycleMode.LEARN)).thenReturn(summary(false));
        when(cycleService.runCycle(third, CycleMode.LEARN)).thenThrow(new FetchException("log store unavailable"));
        when(cycleService.runCycle(fourth, CycleMode.LEARN)).thenReturn(summary(false));

        BackfillResult result = job.backfill(FROM, FROM.plusSeconds(3600), CycleMode.LEARN);

        InOrder order = inOrder(cycleService);
        order.verify(cycleService).runCycle(FROM, CycleMode.LEARN);
        order.verify(cycleService).runCycle(second, CycleMode.LEARN);
        order.verify(cycleService).runCycle(third, CycleMode.LEARN);
        order.verify(cycleService).runCycle(fourth, CycleMode.LEARN);

        assertThat(result.getWindows()).isEqualTo(4);
        assertThat(result.getCommitted()).isEqualTo(2);
        assertThat(result.getAlreadyProcessed()).isEqualTo(1);
        assertThat(result.getFailedWindows()).containsExactly(third);
        assertThat(meterRegistry.counter("anomaly.backfill.windows.failed").count()).isEqualTo(1.0);
    }

    @Test
    void unalignedRangeCoversWindowsStartingInside() {
        when(cycleService.runCycle(any(), eq(CycleMode.DETECT))).thenReturn(summary(false));

        BackfillResult result = job.backfill(FROM.plusSeconds(300), FROM.plusSeconds(1860), CycleMode.DETECT);

        assertThat(result.getWindows()).isEqualTo(2);
        verify(cycleService).runCycle(FROM.plusSeconds(900), CycleMode.DETECT);
        verify(cycleService).runCycle(FROM.plusSeconds(1800), CycleMode.DETECT);
        verify(cycleService, times(2)).runCycle(any(), eq(CycleMode.DETECT));
    }

    @Test
    void emptyRangeIsRejected() {
        assertThatThrownBy(() -> job.backfill(FROM, FROM, CycleMode.LEARN))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(cycleService);
    }

    @Test
    void defaultRangeIsWholeLocalDaysBeforeToday() {
        // 2024-01-22 11:07 CET
        Instant to = job.resolveTo(Instant.parse("2024-01-22T10:07:00Z"));

        assertThat(to).isEqualTo(Instant.parse("2024-01-21T23:00:00Z"));
        assertThat(job.resolveFrom(to)).isEqualTo(Instant.parse("2023-12-31T23:00:00Z"));
    }

    @Test
    void configuredEndNeverReachesTheOpenWindow() {
        properties.getBackfill().setFrom(Instant.parse("2024-01-01T00:00:00Z"));
        properties.getBackfill().setTo(Instant.parse("2024-02-01T00:00:00Z"));

        Instant to = job.resolveTo(Instant.parse("2024-01-22T10:07:00Z"));

        assertThat(to).isEqualTo(Instant.parse("2024-01-22T10:00:00Z"));
        assertThat(job.resolveFrom(to)).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void startupBackfillIsSkippedWithoutLogSource() {
        when(logSource.isAvailable()).thenReturn(false);

        job.runOnStartup();

        verifyNoInteractions(cycleService);
        assertThat(meterRegistry.counter("anomaly.backfill.skipped", "reason", "no_source").count()).isEqualTo(1.0);
    }

    private static CycleSummary summary(boolean alreadyProcessed) {
        return CycleSummary.builder().alreadyProcessed(alreadyProcessed).build();
    }
}
