package com.budgetaudit.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Stub implementation when metrics are disabled.
 */
@Service
@ConditionalOnProperty(name = "budgetaudit.metrics.enabled", havingValue = "false", matchIfMissing = true)
public class AuditMetricsServiceStub implements MetricsServiceInterface {

    @Override
    public void recordProviderLatency(long durationMs, String tier, String model) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordProviderFailure(String tier, String errorType) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordFailover(String servedBy) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordTokens(int tokens, String model, String task) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordValidationFailures(int count, String task) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordDetectorDegraded(String detector) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordJobDuration(long durationMs) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordJobSuccess() {
        // No-op when metrics are disabled
    }

    @Override
    public void recordJobFailure(String errorType) {
        // No-op when metrics are disabled
    }
}
