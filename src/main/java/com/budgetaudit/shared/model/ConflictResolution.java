package com.budgetaudit.shared.model;

public enum ConflictResolution {
    /** Keep the rule-side issue; its value was computed exactly. */
    FAVOR_RULE,
    /** Keep the AI-side issue; it carries the surrounding context. */
    FAVOR_AI,
    /** Keep one issue tagged with both categories. */
    COMPOSITE
}
