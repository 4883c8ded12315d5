package com.budgetaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BudgetAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetAuditApplication.class, args);
    }

    /**
     * Scheduling drives the provider health probe only, so it follows the probe toggle.
     */
    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(name = "budgetaudit.ai.health-probe.enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {
    }
}
