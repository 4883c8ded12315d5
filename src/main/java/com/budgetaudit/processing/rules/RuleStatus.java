package com.budgetaudit.processing.rules;

public enum RuleStatus {
    PENDING,
    PASS,
    VIOLATION,
    SKIPPED,
    ERROR
}
