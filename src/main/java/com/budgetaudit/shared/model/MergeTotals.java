package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"ai", "rule", "merged", "conflicts", "agreements", "aiOnly", "ruleOnly"})
public class MergeTotals {
    private final int ai;
    private final int rule;
    private final int merged;
    private final int conflicts;
    private final int agreements;
    private final int aiOnly;
    private final int ruleOnly;

    public MergeTotals(int ai, int rule, int merged, int conflicts, int agreements, int aiOnly, int ruleOnly) {
        this.ai = ai;
        this.rule = rule;
        this.merged = merged;
        this.conflicts = conflicts;
        this.agreements = agreements;
        this.aiOnly = aiOnly;
        this.ruleOnly = ruleOnly;
    }

    public int getAi() {
        return ai;
    }

    public int getRule() {
        return rule;
    }

    public int getMerged() {
        return merged;
    }

    public int getConflicts() {
        return conflicts;
    }

    public int getAgreements() {
        return agreements;
    }

    public int getAiOnly() {
        return aiOnly;
    }

    public int getRuleOnly() {
        return ruleOnly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MergeTotals that = (MergeTotals) o;
        return ai == that.ai && rule == that.rule && merged == that.merged && conflicts == that.conflicts
                && agreements == that.agreements && aiOnly == that.aiOnly && ruleOnly == that.ruleOnly;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ai, rule, merged, conflicts, agreements, aiOnly, ruleOnly);
    }

    @Override
    public String toString() {
        return "MergeTotals{ai=" + ai + ", rule=" + rule + ", merged=" + merged + ", conflicts=" + conflicts
                + ", agreements=" + agreements + ", aiOnly=" + aiOnly + ", ruleOnly=" + ruleOnly + "}";
    }
}
