package com.budgetaudit.processing.ai;

import java.time.Instant;

/**
 * Mutable health record of one tier. Only {@link ProviderChain} touches it, under its state lock.
 */
class ProviderState {

    private final ProviderTier tier;
    private final String modelId;
    private boolean alive = true;
    private int consecutiveFailures;
    private long lastLatencyMs = -1;
    private Instant lastAttemptAt;
    private String lastError;

    ProviderState(ProviderTier tier, String modelId) {
        this.tier = tier;
        this.modelId = modelId;
    }

    void recordSuccess(long latencyMs, Instant at) {
        alive = true;
        consecutiveFailures = 0;
        lastLatencyMs = latencyMs;
        lastAttemptAt = at;
        lastError = null;
    }

    /**
     * @return true if this failure took the tier out of rotation
     */
    boolean recordFailure(String error, Instant at, int failureThreshold) {
        consecutiveFailures++;
        lastAttemptAt = at;
        lastError = error;
        if (alive && consecutiveFailures >= failureThreshold) {
            alive = false;
            return true;
        }
        return false;
    }

    void revive() {
        alive = true;
        consecutiveFailures = 0;
    }

    boolean isAlive() {
        return alive;
    }

    Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    ProviderTier getTier() {
        return tier;
    }

    ProviderStateSnapshot snapshot() {
        return new ProviderStateSnapshot(tier, modelId, alive, consecutiveFailures, lastLatencyMs, lastAttemptAt, lastError);
    }
}
