package com.budgetaudit.processing.rules;

import com.budgetaudit.shared.model.Issue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RuleEvaluationReport {
    private final List<Issue> findings;
    private final List<RuleOutcome> outcomes;

    public RuleEvaluationReport(List<Issue> findings, List<RuleOutcome> outcomes) {
        this.findings = Collections.unmodifiableList(new ArrayList<>(findings));
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public List<Issue> getFindings() {
        return findings;
    }

    public List<RuleOutcome> getOutcomes() {
        return outcomes;
    }

    public long count(RuleStatus status) {
        return outcomes.stream().filter(outcome -> outcome.getStatus() == status).count();
    }
}
