package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.dto.ExtractResponse;

import java.util.Collections;
import java.util.List;

/**
 * Response served by the chain plus how it was served.
 */
public class ChainResult {
    private final ExtractResponse response;
    private final ProviderTier servedBy;
    private final String modelId;
    private final boolean fellBack;
    private final long latencyMs;
    private final List<ProviderAttempt> attempts;

    public ChainResult(ExtractResponse response, ProviderTier servedBy, String modelId, boolean fellBack,
                       long latencyMs, List<ProviderAttempt> attempts) {
        this.response = response;
        this.servedBy = servedBy;
        this.modelId = modelId;
        this.fellBack = fellBack;
        this.latencyMs = latencyMs;
        this.attempts = Collections.unmodifiableList(attempts);
    }

    public ExtractResponse getResponse() {
        return response;
    }

    public ProviderTier getServedBy() {
        return servedBy;
    }

    public String getModelId() {
        return modelId;
    }

    /**
     * @return true when a tier other than the first configured one answered
     */
    public boolean isFellBack() {
        return fellBack;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }

    public boolean isDegraded() {
        return servedBy == ProviderTier.REGEX_FALLBACK;
    }
}
