package com.budgetaudit.processing.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExtractionMetadata {
    private final boolean disabled;
    private final int tokensUsed;
    private final long elapsedMs;
    private final int windows;
    private final int validationFailures;
    private final List<ProviderCallStat> providerStats;

    public ExtractionMetadata(boolean disabled, int tokensUsed, long elapsedMs, int windows, int validationFailures,
                              List<ProviderCallStat> providerStats) {
        this.disabled = disabled;
        this.tokensUsed = tokensUsed;
        this.elapsedMs = elapsedMs;
        this.windows = windows;
        this.validationFailures = validationFailures;
        this.providerStats = Collections.unmodifiableList(new ArrayList<>(providerStats));
    }

    public static ExtractionMetadata disabled() {
        return new ExtractionMetadata(true, 0, 0, 0, 0, Collections.emptyList());
    }

    public boolean isDisabled() {
        return disabled;
    }

    public int getTokensUsed() {
        return tokensUsed;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public int getWindows() {
        return windows;
    }

    public int getValidationFailures() {
        return validationFailures;
    }

    public List<ProviderCallStat> getProviderStats() {
        return providerStats;
    }

    /**
     * @return true if any window was served by a tier other than the first
     */
    public boolean isFellBack() {
        for (ProviderCallStat stat : providerStats) {
            if (stat.isFellBack()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Flat view stored in the job metadata.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("disabled", disabled);
        map.put("tokensUsed", tokensUsed);
        map.put("elapsedMs", elapsedMs);
        map.put("windows", windows);
        map.put("validationFailures", validationFailures);
        map.put("fellBack", isFellBack());
        List<Map<String, Object>> stats = new ArrayList<>();
        for (ProviderCallStat stat : providerStats) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("task", stat.getTask());
            entry.put("window", stat.getWindow());
            entry.put("tier", stat.getTier().getKey());
            entry.put("model", stat.getModel());
            entry.put("fellBack", stat.isFellBack());
            entry.put("latencyMs", stat.getLatencyMs());
            entry.put("cached", stat.isCached());
            stats.add(entry);
        }
        map.put("providerStats", stats);
        return map;
    }
}
