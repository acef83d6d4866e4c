package com.company.anomaly.config;

import com.company.anomaly.domain.enums.DetectionRuleType;
import com.company.anomaly.repository.DetectionParameterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionConfigProviderTest {

    @Mock
    private DetectionParameterRepository parameterRepository;

    private DetectionConfigProvider configProvider;

    @BeforeEach
    void setUp() {
        configProvider = new DetectionConfigProvider(new AnomalyProperties(), parameterRepository);
    }

    @Test
    void propertyDefaultsApplyWithoutOverrides() {
        when(parameterRepository.findAll()).thenReturn(Map.of());

        DetectionConfig config = configProvider.current();

        assertThat(config).isEqualTo(DetectionConfigFixtures.defaults());
        assertThat(config.getZoneId()).isEqualTo(ZoneId.of("CET"));
        assertThat(config.violations()).isEmpty();
    }

    @Test
    void overridesTakeEffectOnNextCycle() {
        when(parameterRepository.findAll())
                .thenReturn(Map.of())
                .thenReturn(Map.of("ratioThreshold", "5.0", "enabledRules", "ratio-spike, new_category"));

        assertThat(configProvider.current().getRatioThreshold()).isEqualTo(3.0);

        DetectionConfig updated = configProvider.current();
        assertThat(updated.getRatioThreshold()).isEqualTo(5.0);
        assertThat(updated.getEnabledRules())
                .containsExactlyInAnyOrder(DetectionRuleType.RATIO_SPIKE, DetectionRuleType.NEW_CATEGORY);
    }

    @Test
    void invalidOverridesAreIgnored() {
        when(parameterRepository.findAll()).thenReturn(Map.of(
                "ratioThreshold", "abc",
                "sameDayWindowCount", "9",
                "floorValue", "0",
                "noSuchParameter", "1",
                "enabledRules", ""));

        assertThat(configProvider.current()).isEqualTo(DetectionConfigFixtures.defaults());
    }

    @Test
    void countsBeyondIntRangeAreRejectedNotWrapped() {
        // 2^32 + 1 would wrap to 1 if narrowed from a long
        when(parameterRepository.findAll()).thenReturn(Map.of(
                "sameDayWindowCount", "4294967297",
                "burstHistorySize", "4294967304"));

        DetectionConfig config = configProvider.current();

        assertThat(config.getSameDayWindowCount()).isEqualTo(DetectionConfigFixtures.defaults().getSameDayWindowCount());
        assertThat(config.getBurstHistorySize()).isEqualTo(DetectionConfigFixtures.defaults().getBurstHistorySize());
    }
}
