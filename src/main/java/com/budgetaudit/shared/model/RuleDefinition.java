package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One declarative rule of a rule set. Which optional fields apply depends on {@link #getType()}:
 * table presence uses {@code table}; numeric consistency uses {@code left}, {@code right} and
 * {@code tolerance}; the text/number cross-check uses the section regexes, reason settings and
 * optionally {@code aiTask}.
 */
public class RuleDefinition {
    private final String id;
    private final String category;
    private final Severity severity;
    private final RuleType type;
    private final String messageTemplate;
    private final Tolerance tolerance;
    private final String table;
    private final Double lowConfidenceThreshold;
    private final OperandDefinition left;
    private final OperandDefinition right;
    private final String sectionStart;
    private final String sectionEnd;
    private final Integer reasonWindow;
    private final String reasonAnchor;
    private final String aiTask;

    @JsonCreator
    public RuleDefinition(@JsonProperty("id") String id,
                          @JsonProperty("category") String category,
                          @JsonProperty("severity") Severity severity,
                          @JsonProperty("type") RuleType type,
                          @JsonProperty("message") String messageTemplate,
                          @JsonProperty("tolerance") Tolerance tolerance,
                          @JsonProperty("table") String table,
                          @JsonProperty("low_confidence_threshold") Double lowConfidenceThreshold,
                          @JsonProperty("left") OperandDefinition left,
                          @JsonProperty("right") OperandDefinition right,
                          @JsonProperty("section_start") String sectionStart,
                          @JsonProperty("section_end") String sectionEnd,
                          @JsonProperty("reason_window") Integer reasonWindow,
                          @JsonProperty("reason_anchor") String reasonAnchor,
                          @JsonProperty("ai_task") String aiTask) {
        this.id = id;
        this.category = category;
        this.severity = severity != null ? severity : Severity.MEDIUM;
        this.type = type;
        this.messageTemplate = messageTemplate;
        this.tolerance = tolerance != null ? tolerance : Tolerance.DEFAULT;
        this.table = table;
        this.lowConfidenceThreshold = lowConfidenceThreshold;
        this.left = left;
        this.right = right;
        this.sectionStart = sectionStart;
        this.sectionEnd = sectionEnd;
        this.reasonWindow = reasonWindow;
        this.reasonAnchor = reasonAnchor;
        this.aiTask = aiTask;
    }

    /**
     * Fills {@code {name}} placeholders of the message template; unknown placeholders stay as they are.
     */
    public String renderMessage(Map<String, String> values, String fallback) {
        if (messageTemplate == null || messageTemplate.isBlank()) {
            return fallback;
        }
        String rendered = messageTemplate;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", entry.getValue() != null ? entry.getValue() : "");
        }
        return rendered;
    }

    public String getId() {
        return id;
    }

    public String getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public RuleType getType() {
        return type;
    }

    public String getMessageTemplate() {
        return messageTemplate;
    }

    public Tolerance getTolerance() {
        return tolerance;
    }

    public String getTable() {
        return table;
    }

    public Double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    public OperandDefinition getLeft() {
        return left;
    }

    public OperandDefinition getRight() {
        return right;
    }

    public String getSectionStart() {
        return sectionStart;
    }

    public String getSectionEnd() {
        return sectionEnd;
    }

    public Integer getReasonWindow() {
        return reasonWindow;
    }

    public String getReasonAnchor() {
        return reasonAnchor;
    }

    public String getAiTask() {
        return aiTask;
    }
}
