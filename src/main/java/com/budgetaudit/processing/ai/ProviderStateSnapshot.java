package com.budgetaudit.processing.ai;

import java.time.Instant;

/**
 * Point-in-time copy of a tier's health, safe to hand to health checks and logs.
 */
public class ProviderStateSnapshot {
    private final ProviderTier tier;
    private final String modelId;
    private final boolean alive;
    private final int consecutiveFailures;
    private final long lastLatencyMs;
    private final Instant lastAttemptAt;
    private final String lastError;

    public ProviderStateSnapshot(ProviderTier tier, String modelId, boolean alive, int consecutiveFailures,
                                 long lastLatencyMs, Instant lastAttemptAt, String lastError) {
        this.tier = tier;
        this.modelId = modelId;
        this.alive = alive;
        this.consecutiveFailures = consecutiveFailures;
        this.lastLatencyMs = lastLatencyMs;
        this.lastAttemptAt = lastAttemptAt;
        this.lastError = lastError;
    }

    public ProviderTier getTier() {
        return tier;
    }

    public String getModelId() {
        return modelId;
    }

    public boolean isAlive() {
        return alive;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * @return latency of the last successful call, -1 if none yet
     */
    public long getLastLatencyMs() {
        return lastLatencyMs;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    public String getLastError() {
        return lastError;
    }
}
