package com.company.anomaly.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.HashMap;
import java.util.Map;

@Configuration
public class OpenTelemetryConfig {

    private static final String[] SDK_KEYS = {
            "otel.service.name",
            "otel.traces.exporter",
            "otel.metrics.exporter",
            "otel.logs.exporter"
    };

    /**
     * SDK settings from application.yml act as defaults; OTEL_* env vars and system properties still win
     */
    @Bean
    public OpenTelemetry openTelemetry(Environment environment) {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> sdkDefaults(environment))
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("error-anomaly-service");
    }

    private static Map<String, String> sdkDefaults(Environment environment) {
        Map<String, String> defaults = new HashMap<>();
        for (String key : SDK_KEYS) {
            String value = environment.getProperty(key);
            if (value != null) {
                defaults.put(key, value);
            }
        }
        return defaults;
    }
}
