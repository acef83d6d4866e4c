package com.company.anomaly.config;

import com.company.anomaly.domain.enums.InvestigationStatus;
import com.company.anomaly.repository.BaselineStore;
import com.company.anomaly.repository.InvestigationRepository;
import com.company.anomaly.repository.ProblemRegistryRepository;
import com.company.anomaly.repository.RegistryReviewRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.ToDoubleFunction;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final BaselineStore baselineStore;
    private final ProblemRegistryRepository registryRepository;
    private final RegistryReviewRepository reviewRepository;
    private final InvestigationRepository investigationRepository;

    @Bean
    public MeterBinder anomalyMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("anomaly.grid.completeness", baselineStore,
                            safely("grid completeness", BaselineStore::gridCompleteness))
                    .description("Baseline records present as percent of the full week grid")
                    .baseUnit("percent")
                    .register(reg);

            Gauge.builder("anomaly.registry.known", registryRepository,
                            safely("known problems", ProblemRegistryRepository::countKnown))
                    .description("Problems currently classified as known")
                    .register(reg);

            Gauge.builder("anomaly.registry.review.open", reviewRepository,
                            safely("open review items", RegistryReviewRepository::countOpen))
                    .description("Ambiguous registry matches waiting for review")
                    .register(reg);

            Gauge.builder("anomaly.investigations.new", investigationRepository,
                            safely("new investigations", repo -> repo.countByStatus(InvestigationStatus.NEW)))
                    .description("Investigations nobody has acknowledged yet")
                    .register(reg);

            log.info("Anomaly metrics registered");
        };
    }

    private static <T> ToDoubleFunction<T> safely(String name, ToDoubleFunction<T> reading) {
        return target -> {
            try {
                return reading.applyAsDouble(target);
            } catch (Exception e) {
                log.warn("Failed to read gauge {}", name, e);
                return Double.NaN;
            }
        };
    }
}
