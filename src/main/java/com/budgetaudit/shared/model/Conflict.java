package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A matched rule/AI pair whose findings diverge, with the policy decision taken for it.
 */
@JsonPropertyOrder({"key", "aiIssueId", "ruleIssueId", "reason", "resolution", "finalSeverity"})
public class Conflict {
    private final String key;
    private final String aiIssueId;
    private final String ruleIssueId;
    private final ConflictReason reason;
    private final ConflictResolution resolution;
    private final Severity finalSeverity;

    public Conflict(String key, String aiIssueId, String ruleIssueId, ConflictReason reason,
                    ConflictResolution resolution, Severity finalSeverity) {
        this.key = key;
        this.aiIssueId = aiIssueId;
        this.ruleIssueId = ruleIssueId;
        this.reason = reason;
        this.resolution = resolution;
        this.finalSeverity = finalSeverity;
    }

    public String getKey() {
        return key;
    }

    public String getAiIssueId() {
        return aiIssueId;
    }

    public String getRuleIssueId() {
        return ruleIssueId;
    }

    public ConflictReason getReason() {
        return reason;
    }

    public ConflictResolution getResolution() {
        return resolution;
    }

    public Severity getFinalSeverity() {
        return finalSeverity;
    }
}
