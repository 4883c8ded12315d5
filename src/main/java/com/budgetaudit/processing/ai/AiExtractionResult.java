package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.model.Issue;

import java.util.Collections;
import java.util.List;

public class AiExtractionResult {
    private final List<Issue> findings;
    private final ExtractionMetadata metadata;

    public AiExtractionResult(List<Issue> findings, ExtractionMetadata metadata) {
        this.findings = Collections.unmodifiableList(findings);
        this.metadata = metadata;
    }

    public static AiExtractionResult disabled() {
        return new AiExtractionResult(Collections.emptyList(), ExtractionMetadata.disabled());
    }

    public List<Issue> getFindings() {
        return findings;
    }

    public ExtractionMetadata getMetadata() {
        return metadata;
    }
}
