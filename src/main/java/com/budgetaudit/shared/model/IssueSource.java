package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which detector produced an issue.
 */
public enum IssueSource {
    RULE("rule"),
    AI("ai");

    private final String key;

    IssueSource(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
