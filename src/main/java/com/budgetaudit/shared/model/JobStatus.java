package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
