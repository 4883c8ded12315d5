package com.budgetaudit.processing.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically returns dead tiers to rotation once they have rested for the half-open interval.
 */
@Component
@ConditionalOnProperty(name = "budgetaudit.ai.health-probe.enabled", havingValue = "true", matchIfMissing = true)
public class ProviderHealthProbe {

    private static final Logger logger = LoggerFactory.getLogger(ProviderHealthProbe.class);

    private final ProviderChain providerChain;
    private final Duration halfOpenAfter;

    public ProviderHealthProbe(ProviderChain providerChain,
                               @Value("${budgetaudit.ai.half-open-seconds:60}") long halfOpenSeconds) {
        this.providerChain = providerChain;
        this.halfOpenAfter = Duration.ofSeconds(halfOpenSeconds);
    }

    @Scheduled(fixedDelayString = "${budgetaudit.ai.health-probe.interval-ms:30000}",
            initialDelayString = "${budgetaudit.ai.health-probe.interval-ms:30000}")
    public void probe() {
        int revived = providerChain.resetStale(halfOpenAfter);
        if (revived > 0) {
            logger.info("Health probe revived {} provider tier(s)", revived);
        }
    }
}
