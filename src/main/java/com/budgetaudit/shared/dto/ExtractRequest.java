package com.budgetaudit.shared.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire request of the AI extraction protocol. Spans in the response refer to {@code sectionText}.
 */
public class ExtractRequest {

    private String task;
    @JsonProperty("section_text")
    @JsonAlias("sectionText")
    private String sectionText;
    @JsonProperty("doc_hash")
    @JsonAlias("docHash")
    private String docHash;
    @JsonProperty("max_windows")
    @JsonAlias("maxWindows")
    private int maxWindows;

    public ExtractRequest() {
    }

    public ExtractRequest(String task, String sectionText, String docHash, int maxWindows) {
        this.task = task;
        this.sectionText = sectionText;
        this.docHash = docHash;
        this.maxWindows = maxWindows;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public String getSectionText() {
        return sectionText;
    }

    public void setSectionText(String sectionText) {
        this.sectionText = sectionText;
    }

    public String getDocHash() {
        return docHash;
    }

    public void setDocHash(String docHash) {
        this.docHash = docHash;
    }

    public int getMaxWindows() {
        return maxWindows;
    }

    public void setMaxWindows(int maxWindows) {
        this.maxWindows = maxWindows;
    }
}
