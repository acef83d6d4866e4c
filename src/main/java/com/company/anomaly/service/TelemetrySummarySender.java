package com.company.anomaly.service;

import com.company.anomaly.domain.CycleSummary;
import com.company.anomaly.event.CycleFailedEvent;
import com.company.anomaly.exception.NotificationSendException;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ships cycle summaries as spans; dashboards and chat hooks subscribe to the exporter
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TelemetrySummarySender {

    private final Tracer tracer;

    public void sendSummary(CycleSummary summary) {
        Span span = tracer.spanBuilder("anomaly.cycle.summary")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("cycle.id", summary.getCycleId());
            span.setAttribute("window.start", summary.getWindowStart().toString());
            span.setAttribute("observations", summary.getObservations());
            span.setAttribute("anomalies.known", summary.getKnownAnomalies());
            span.setAttribute("anomalies.new", summary.getNewAnomalies());
            span.setAttribute("grid.completeness_percent", summary.getGridCompletenessPercent());

            span.addEvent("Cycle summary",
                    Attributes.of(
                            AttributeKey.longKey("skipped_categories"), (long) summary.getSkippedCategories().size(),
                            AttributeKey.longKey("review_items"), (long) summary.getReviewItems(),
                            AttributeKey.doubleKey("fetch_coverage_percent"), summary.fetchCoveragePercent()
                    ));

            if (!summary.getSkippedCategories().isEmpty()) {
                span.addEvent("Categories skipped",
                        Attributes.of(AttributeKey.stringKey("reasons"), summary.getSkippedCategories().toString()));
            }

            log.info("Cycle summary sent for window {}: {} known, {} new anomalies",
                    summary.getWindowStart(), summary.getKnownAnomalies(), summary.getNewAnomalies());

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send cycle summary");
            throw new NotificationSendException("Failed to send cycle summary", e);
        } finally {
            span.end();
        }
    }

    public void sendFailure(CycleFailedEvent event) {
        Span span = tracer.spanBuilder("anomaly.cycle.failed")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("cycle.id", event.getCycleId());
            span.setAttribute("window.start", event.getWindowStart().toString());
            span.setAttribute("error.type", event.getErrorType());
            span.setStatus(StatusCode.ERROR, event.getReason());

            log.info("Cycle failure sent for window {}", event.getWindowStart());

        } catch (Exception e) {
            span.recordException(e);
            throw new NotificationSendException("Failed to send cycle failure", e);
        } finally {
            span.end();
        }
    }
}
