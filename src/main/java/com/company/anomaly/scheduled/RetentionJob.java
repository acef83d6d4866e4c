package com.company.anomaly.scheduled;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.config.DetectionConfigProvider;
import com.company.anomaly.repository.BaselineStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Baseline retention. Investigations and registry entries are audit data and are never purged here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "anomaly.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RetentionJob {

    private final BaselineStore baselineStore;
    private final DetectionConfigProvider configProvider;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${anomaly.retention.cron:0 30 3 * * *}")
    public void purgeExpiredBaselineData() {
        log.info("Starting baseline retention job");

        try {
            DetectionConfig config = configProvider.current();
            Instant cutoff = Instant.now().minus(Duration.ofDays(config.getRetentionDays()));

            int samples = baselineStore.purgeSamplesBefore(cutoff);
            int records = baselineStore.purgeRecordsNotUpdatedSince(cutoff);

            meterRegistry.counter("anomaly.retention.samples.purged").increment(samples);
            meterRegistry.counter("anomaly.retention.records.purged").increment(records);
            meterRegistry.counter("anomaly.retention.success").increment();

            log.info("Retention ({} days) removed {} samples and {} stale baseline records",
                    config.getRetentionDays(), samples, records);

        } catch (Exception e) {
            log.error("Baseline retention job failed", e);
            meterRegistry.counter("anomaly.retention.failures").increment();
        }
    }
}
