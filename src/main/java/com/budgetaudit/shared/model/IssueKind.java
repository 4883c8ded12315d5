package com.budgetaudit.shared.model;

/**
 * Nature of the evidence behind an issue. Conflict resolution trusts computed values for NUMERIC issues
 * and surrounding context for NARRATIVE ones.
 */
public enum IssueKind {
    NUMERIC,
    NARRATIVE,
    STRUCTURAL
}
