package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of the merge step. {@code aiFindings} and {@code ruleFindings} are the untouched inputs;
 * {@code merged} is the ranked final list. Agreements are keyed {@code ruleIssueId|aiIssueId}.
 */
@JsonPropertyOrder({"aiFindings", "ruleFindings", "merged", "conflicts", "agreements", "aiOnly", "ruleOnly",
        "warnings", "totals"})
public class MergedResult {
    private final List<Issue> aiFindings;
    private final List<Issue> ruleFindings;
    private final List<Issue> merged;
    private final List<Conflict> conflicts;
    private final List<String> agreements;
    private final List<String> aiOnly;
    private final List<String> ruleOnly;
    private final List<String> warnings;
    private final MergeTotals totals;

    public MergedResult(List<Issue> aiFindings, List<Issue> ruleFindings, List<Issue> merged,
                        List<Conflict> conflicts, List<String> agreements, List<String> aiOnly,
                        List<String> ruleOnly, List<String> warnings, MergeTotals totals) {
        this.aiFindings = copy(aiFindings);
        this.ruleFindings = copy(ruleFindings);
        this.merged = copy(merged);
        this.conflicts = copy(conflicts);
        this.agreements = copy(agreements);
        this.aiOnly = copy(aiOnly);
        this.ruleOnly = copy(ruleOnly);
        this.warnings = copy(warnings);
        this.totals = totals;
    }

    private static <T> List<T> copy(List<T> values) {
        return values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : Collections.emptyList();
    }

    public List<Issue> getAiFindings() {
        return aiFindings;
    }

    public List<Issue> getRuleFindings() {
        return ruleFindings;
    }

    public List<Issue> getMerged() {
        return merged;
    }

    public List<Conflict> getConflicts() {
        return conflicts;
    }

    public List<String> getAgreements() {
        return agreements;
    }

    /** Ids of AI issues with no rule counterpart. */
    public List<String> getAiOnly() {
        return aiOnly;
    }

    /** Ids of rule issues with no AI counterpart. */
    public List<String> getRuleOnly() {
        return ruleOnly;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public MergeTotals getTotals() {
        return totals;
    }
}
