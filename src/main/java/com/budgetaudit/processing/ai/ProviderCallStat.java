package com.budgetaudit.processing.ai;

/**
 * How one window of one task was served.
 */
public class ProviderCallStat {
    private final String task;
    private final int window;
    private final ProviderTier tier;
    private final String model;
    private final boolean fellBack;
    private final long latencyMs;
    private final boolean cached;

    public ProviderCallStat(String task, int window, ProviderTier tier, String model, boolean fellBack,
                            long latencyMs, boolean cached) {
        this.task = task;
        this.window = window;
        this.tier = tier;
        this.model = model;
        this.fellBack = fellBack;
        this.latencyMs = latencyMs;
        this.cached = cached;
    }

    public String getTask() {
        return task;
    }

    public int getWindow() {
        return window;
    }

    public ProviderTier getTier() {
        return tier;
    }

    public String getModel() {
        return model;
    }

    public boolean isFellBack() {
        return fellBack;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public boolean isCached() {
        return cached;
    }
}
