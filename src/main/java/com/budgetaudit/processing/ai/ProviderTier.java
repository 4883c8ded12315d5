package com.budgetaudit.processing.ai;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Position in the failover chain, in calling order. The regex fallback is not a configured tier;
 * it answers when every tier has failed.
 */
public enum ProviderTier {
    PRIMARY("primary"),
    BACKUP("backup"),
    DISASTER_PRIMARY("disasterPrimary"),
    DISASTER_BACKUP("disasterBackup"),
    REGEX_FALLBACK("regexFallback");

    private final String key;

    ProviderTier(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
