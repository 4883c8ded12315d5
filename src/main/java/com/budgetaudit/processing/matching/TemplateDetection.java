package com.budgetaudit.processing.matching;

import com.budgetaudit.shared.model.RuleSet;

/**
 * Outcome of cover-page template detection. {@code ruleSet} is null when no template scored at all.
 */
public class TemplateDetection {
    private final RuleSet ruleSet;
    private final int score;
    private final int margin;
    private final double confidence;
    private final boolean determined;

    public TemplateDetection(RuleSet ruleSet, int score, int margin, double confidence, boolean determined) {
        this.ruleSet = ruleSet;
        this.score = score;
        this.margin = margin;
        this.confidence = confidence;
        this.determined = determined;
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    public int getScore() {
        return score;
    }

    public int getMargin() {
        return margin;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * True when the best template is confident enough and clearly ahead of the runner-up.
     */
    public boolean isDetermined() {
        return determined;
    }
}
