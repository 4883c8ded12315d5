package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Finding severity, ordered from least to most severe.
 */
public enum Severity {
    INFO(1, "info"),
    LOW(2, "low"),
    MEDIUM(3, "medium"),
    HIGH(4, "high"),
    CRITICAL(5, "critical");

    private final int rank;
    private final String key;

    Severity(int rank, String key) {
        this.rank = rank;
        this.key = key;
    }

    public int getRank() {
        return rank;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * One level down; INFO stays INFO.
     */
    public Severity lower() {
        return this == INFO ? INFO : values()[ordinal() - 1];
    }

    public static Severity max(Severity a, Severity b) {
        return a.rank >= b.rank ? a : b;
    }

    /**
     * Accepts the canonical keys plus the rule-file shorthands "error", "warn" and "warning".
     */
    @JsonCreator
    public static Severity fromKey(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "fatal":
                return CRITICAL;
            case "error":
                return HIGH;
            case "warn":
            case "warning":
                return LOW;
            default:
                for (Severity severity : values()) {
                    if (severity.key.equals(normalized)) {
                        return severity;
                    }
                }
                throw new IllegalArgumentException("Unknown severity: " + value);
        }
    }
}
