package com.budgetaudit.processing;

/**
 * Named stages of a job with their share of the progress bar. The weights add up to 100.
 */
public enum JobStage {
    EXTRACTION_HANDOFF("extraction-handoff", 10),
    RULE_EVALUATION("rule-evaluation", 30),
    AI_EXTRACTION("ai-extraction", 40),
    MERGE("merge", 20);

    private final String key;
    private final int weight;

    JobStage(String key, int weight) {
        this.key = key;
        this.weight = weight;
    }

    public String getKey() {
        return key;
    }

    public int getWeight() {
        return weight;
    }
}
