package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A versioned rule set: the template's tables, its rules, and the cover-page signals used to pick it.
 * Never modified after loading; a reload produces a new instance.
 */
public class RuleSet {
    private final String name;
    private final String version;
    private final String scope;
    private final List<String> aliases;
    private final List<String> anchors;
    private final List<TableSpec> tables;
    private final List<RuleDefinition> rules;

    @JsonCreator
    public RuleSet(@JsonProperty("name") String name,
                   @JsonProperty("version") String version,
                   @JsonProperty("scope") String scope,
                   @JsonProperty("aliases") List<String> aliases,
                   @JsonProperty("anchors") List<String> anchors,
                   @JsonProperty("tables") List<TableSpec> tables,
                   @JsonProperty("rules") List<RuleDefinition> rules) {
        this.name = name;
        this.version = version;
        this.scope = scope;
        this.aliases = copy(aliases);
        this.anchors = copy(anchors);
        this.tables = copy(tables);
        this.rules = copy(rules);
    }

    private static <T> List<T> copy(List<T> values) {
        return values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : Collections.emptyList();
    }

    public Optional<TableSpec> findTable(String canonicalName) {
        for (TableSpec table : tables) {
            if (table.getCanonicalName().equals(canonicalName)) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getScope() {
        return scope;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public List<String> getAnchors() {
        return anchors;
    }

    public List<TableSpec> getTables() {
        return tables;
    }

    public List<RuleDefinition> getRules() {
        return rules;
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
