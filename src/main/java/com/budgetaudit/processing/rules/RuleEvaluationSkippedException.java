package com.budgetaudit.processing.rules;

/**
 * A rule could not be evaluated against this document (missing operand, section or table).
 * Skips are logged and reported, never treated as failures.
 */
public class RuleEvaluationSkippedException extends RuntimeException {

    public RuleEvaluationSkippedException(String message) {
        super(message);
    }
}
