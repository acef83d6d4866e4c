package com.company.anomaly.config;

import com.company.anomaly.domain.enums.CycleMode;
import com.company.anomaly.domain.enums.DetectionRuleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Startup defaults. Detection thresholds can be overridden at runtime through
 * the detection_parameters table, see {@link DetectionConfigProvider}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    /** Zone used to map instants to periods of the week */
    @NotBlank
    private String zoneId = "CET";

    @Valid
    private final Ingestion ingestion = new Ingestion();
    @Valid
    private final Source source = new Source();
    private final Retention retention = new Retention();
    @Valid
    private final Backfill backfill = new Backfill();
    @Valid
    private final Detection detection = new Detection();
    @Valid
    private final Registry registry = new Registry();

    @Data
    public static class Ingestion {
        private boolean enabled = true;
        /** Runs shortly after each quarter hour closes */
        private String cron = "0 2/15 * * * *";
        /** How many windows back an aborted window is retried */
        @Min(0)
        private int retryWindows = 4;
    }

    @Data
    public static class Source {
        private Duration timeout = Duration.ofSeconds(60);
        @Positive
        private int sampleEventLimit = 200;
        @Positive
        private int maxConcurrentCalls = 4;
    }

    /**
     * One-off walk over past windows at startup. Windows already in the cycle ledger are skipped.
     */
    @Data
    public static class Backfill {
        private boolean enabled = false;
        /** LEARN builds the first baseline, DETECT replays detection over history */
        @NotNull
        private CycleMode mode = CycleMode.LEARN;
        /** Range used when {@code from} is not set: this many local days before today */
        @Min(1)
        private int days = 21;
        private Instant from;
        /** Exclusive; defaults to local midnight of today */
        private Instant to;
    }

    @Data
    public static class Retention {
        private boolean enabled = true;
        private String cron = "0 30 3 * * *";
    }

    @Data
    public static class Detection {
        @Positive
        private double ratioThreshold = 3.0;
        @Positive
        private double baselineMultiplier = 4.0;
        @Positive
        private double largeBaselineMean = 10.0;
        @Min(1)
        private long minimumSupportCount = 5;
        @Min(0)
        private long absoluteFloorValue = 10;
        @Positive
        private double floorValue = 1.0;
        @Min(1)
        @Max(6)
        private int sameDayWindowCount = 3;
        @Positive
        private double burstDeviationK = 3.0;
        @Min(1)
        private int burstMinHistory = 4;
        @Min(1)
        private int burstHistorySize = 8;
        @Min(1)
        private int retentionDays = 90;
        @NotEmpty
        private Set<DetectionRuleType> enabledRules = EnumSet.allOf(DetectionRuleType.class);
    }

    @Data
    public static class Registry {
        @Min(1)
        private long knownAfterOccurrences = 3;
        /** 0 disables the age based promotion */
        @Min(0)
        private long knownAfterAgeHours = 0;
    }
}
