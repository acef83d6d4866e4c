package com.company.anomaly.service;

import com.company.anomaly.domain.CycleSummary;
import com.company.anomaly.event.CycleCompletedEvent;
import com.company.anomaly.event.CycleFailedEvent;
import com.company.anomaly.exception.NotificationSendException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Forwards cycle outcomes off the ingestion thread. A failed notification never
 * affects the committed cycle.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryNotificationService {

    private final TelemetrySummarySender summarySender;
    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void onCycleCompleted(CycleCompletedEvent event) {
        CycleSummary summary = event.getSummary();

        try {
            summarySender.sendSummary(summary);
            meterRegistry.counter("anomaly.notifications.sent", "type", "summary").increment();
        } catch (NotificationSendException e) {
            log.error("Failed to send summary for window {}", summary.getWindowStart(), e);
            meterRegistry.counter("anomaly.notifications.failed", "type", "summary").increment();
        }
    }

    @EventListener
    @Async
    public void onCycleFailed(CycleFailedEvent event) {
        try {
            summarySender.sendFailure(event);
            meterRegistry.counter("anomaly.notifications.sent", "type", "failure").increment();
        } catch (NotificationSendException e) {
            log.error("Failed to send failure notice for window {}", event.getWindowStart(), e);
            meterRegistry.counter("anomaly.notifications.failed", "type", "failure").increment();
        }
    }
}
