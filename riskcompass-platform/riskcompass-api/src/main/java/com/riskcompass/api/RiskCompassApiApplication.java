package com.riskcompass.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * RiskCompass API Application
 *
 * Evidence-weighted compliance scoring with gated gap analysis and remediation roadmaps.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.riskcompass")
@EntityScan(basePackages = "com.riskcompass.core.domain")
@EnableJpaRepositories(basePackages = "com.riskcompass.core.repository")
public class RiskCompassApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskCompassApiApplication.class, args);
    }
}
