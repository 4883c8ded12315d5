package com.budgetaudit.processing.rules;

/**
 * How a single rule ended for one document; {@code detail} explains skips and errors.
 */
public class RuleOutcome {
    private final String ruleId;
    private final RuleStatus status;
    private final int findings;
    private final String detail;

    public RuleOutcome(String ruleId, RuleStatus status, int findings, String detail) {
        this.ruleId = ruleId;
        this.status = status;
        this.findings = findings;
        this.detail = detail;
    }

    public String getRuleId() {
        return ruleId;
    }

    public RuleStatus getStatus() {
        return status;
    }

    public int getFindings() {
        return findings;
    }

    public String getDetail() {
        return detail;
    }
}
