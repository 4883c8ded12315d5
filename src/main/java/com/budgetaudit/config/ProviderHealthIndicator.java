package com.budgetaudit.config;

import com.budgetaudit.processing.ai.ProviderChain;
import com.budgetaudit.processing.ai.ProviderStateSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports each provider tier. The service stays UP with every tier dead because the regex
 * fallback still answers; that case is flagged as degraded.
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private final ProviderChain providerChain;

    public ProviderHealthIndicator(ProviderChain providerChain) {
        this.providerChain = providerChain;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        List<ProviderStateSnapshot> snapshots = providerChain.snapshots();
        int alive = 0;
        for (ProviderStateSnapshot snapshot : snapshots) {
            Map<String, Object> tier = new LinkedHashMap<>();
            tier.put("model", snapshot.getModelId());
            tier.put("alive", snapshot.isAlive());
            tier.put("consecutiveFailures", snapshot.getConsecutiveFailures());
            tier.put("lastLatencyMs", snapshot.getLastLatencyMs());
            if (snapshot.getLastError() != null) {
                tier.put("lastError", snapshot.getLastError());
            }
            details.put(snapshot.getTier().getKey(), tier);
            if (snapshot.isAlive()) {
                alive++;
            }
        }
        details.put("aliveTiers", alive);
        details.put("degraded", alive == 0);
        return Health.up()
                .withDetails(details)
                .build();
    }
}
