package com.company.anomaly;

import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyDetectionApplicationTest {

    @Test
    void startsAsServletApplicationSoActuatorEndpointsAreServed() {
        SpringApplication application = new SpringApplication(AnomalyDetectionApplication.class);

        assertThat(application.getWebApplicationType()).isEqualTo(WebApplicationType.SERVLET);
    }
}
