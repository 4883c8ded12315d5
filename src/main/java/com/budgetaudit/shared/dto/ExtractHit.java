package com.budgetaudit.shared.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One statement reported by an extractor. Spans are {@code [start, end)} pairs into the request's section text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractHit {

    @JsonProperty("budget_text")
    @JsonAlias("budgetText")
    private String budgetText;
    @JsonProperty("budget_span")
    @JsonAlias("budgetSpan")
    private List<Integer> budgetSpan;
    @JsonProperty("final_text")
    @JsonAlias("finalText")
    private String finalText;
    @JsonProperty("final_span")
    @JsonAlias("finalSpan")
    private List<Integer> finalSpan;
    @JsonProperty("stmt_text")
    @JsonAlias("stmtText")
    private String stmtText;
    @JsonProperty("stmt_span")
    @JsonAlias("stmtSpan")
    private List<Integer> stmtSpan;
    @JsonProperty("reason_text")
    @JsonAlias("reasonText")
    private String reasonText;
    @JsonProperty("reason_span")
    @JsonAlias("reasonSpan")
    private List<Integer> reasonSpan;
    @JsonProperty("item_title")
    @JsonAlias("itemTitle")
    private String itemTitle;
    private String clip;

    public ExtractHit() {
    }

    public String getBudgetText() {
        return budgetText;
    }

    public void setBudgetText(String budgetText) {
        this.budgetText = budgetText;
    }

    public List<Integer> getBudgetSpan() {
        return budgetSpan;
    }

    public void setBudgetSpan(List<Integer> budgetSpan) {
        this.budgetSpan = budgetSpan;
    }

    public String getFinalText() {
        return finalText;
    }

    public void setFinalText(String finalText) {
        this.finalText = finalText;
    }

    public List<Integer> getFinalSpan() {
        return finalSpan;
    }

    public void setFinalSpan(List<Integer> finalSpan) {
        this.finalSpan = finalSpan;
    }

    public String getStmtText() {
        return stmtText;
    }

    public void setStmtText(String stmtText) {
        this.stmtText = stmtText;
    }

    public List<Integer> getStmtSpan() {
        return stmtSpan;
    }

    public void setStmtSpan(List<Integer> stmtSpan) {
        this.stmtSpan = stmtSpan;
    }

    public String getReasonText() {
        return reasonText;
    }

    public void setReasonText(String reasonText) {
        this.reasonText = reasonText;
    }

    public List<Integer> getReasonSpan() {
        return reasonSpan;
    }

    public void setReasonSpan(List<Integer> reasonSpan) {
        this.reasonSpan = reasonSpan;
    }

    public String getItemTitle() {
        return itemTitle;
    }

    public void setItemTitle(String itemTitle) {
        this.itemTitle = itemTitle;
    }

    public String getClip() {
        return clip;
    }

    public void setClip(String clip) {
        this.clip = clip;
    }
}
