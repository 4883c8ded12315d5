package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mandatory (or optional) table of the disclosure template, with the names it may appear under.
 */
public class TableSpec {
    private final String canonicalName;
    private final List<String> aliases;
    private final boolean required;
    private final String category;
    private final Severity severity;
    private final String scope;

    @JsonCreator
    public TableSpec(@JsonProperty("name") String canonicalName,
                     @JsonProperty("aliases") List<String> aliases,
                     @JsonProperty("required") Boolean required,
                     @JsonProperty("category") String category,
                     @JsonProperty("severity") Severity severity,
                     @JsonProperty("scope") String scope) {
        this.canonicalName = canonicalName;
        this.aliases = aliases != null ? Collections.unmodifiableList(new ArrayList<>(aliases)) : Collections.emptyList();
        this.required = required == null || required;
        this.category = category != null ? category : "structure";
        this.severity = severity != null ? severity : Severity.HIGH;
        this.scope = scope;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public boolean isRequired() {
        return required;
    }

    public String getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getScope() {
        return scope;
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
