package com.budgetaudit.processing.ai;

/**
 * One call made while serving a request.
 */
public class ProviderAttempt {
    private final ProviderTier tier;
    private final String modelId;
    private final boolean success;
    private final long latencyMs;
    private final ProviderErrorType errorType;

    public ProviderAttempt(ProviderTier tier, String modelId, boolean success, long latencyMs, ProviderErrorType errorType) {
        this.tier = tier;
        this.modelId = modelId;
        this.success = success;
        this.latencyMs = latencyMs;
        this.errorType = errorType;
    }

    public ProviderTier getTier() {
        return tier;
    }

    public String getModelId() {
        return modelId;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public ProviderErrorType getErrorType() {
        return errorType;
    }
}
