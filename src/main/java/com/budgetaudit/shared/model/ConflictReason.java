package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictReason {
    SEVERITY_MISMATCH("severityMismatch"),
    CATEGORY_MISMATCH("categoryMismatch"),
    SCOPE_MISMATCH("scopeMismatch"),
    MISSING("missing");

    private final String key;

    ConflictReason(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
