package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A single finding from either detector. The {@link #getSource() source} field tells rule findings
 * and AI findings apart; both share this one shape so the merge step can compare them field by field.
 */
@JsonPropertyOrder({"id", "source", "severity", "ruleId", "category", "kind", "title", "message",
        "evidence", "location", "confidence", "tags", "metrics", "suggestion", "createdAt"})
public class Issue {
    private final String id;
    private final IssueSource source;
    private final Severity severity;
    private final String ruleId;
    private final String category;
    private final IssueKind kind;
    private final String title;
    private final String message;
    private final List<Evidence> evidence;
    private final IssueLocation location;
    private final double confidence;
    private final Set<String> tags;
    private final Map<String, Double> metrics;
    private final String suggestion;
    private final Instant createdAt;

    private Issue(Builder builder) {
        this.id = builder.id;
        this.source = builder.source;
        this.severity = builder.severity;
        this.ruleId = builder.ruleId;
        this.category = builder.category;
        this.kind = builder.kind;
        this.title = builder.title;
        this.message = builder.message;
        this.evidence = Collections.unmodifiableList(new ArrayList<>(builder.evidence));
        this.location = builder.location;
        this.confidence = Math.max(0.0, Math.min(1.0, builder.confidence));
        this.tags = Collections.unmodifiableSet(new TreeSet<>(builder.tags));
        this.metrics = Collections.unmodifiableMap(new TreeMap<>(builder.metrics));
        this.suggestion = builder.suggestion;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .id(id)
                .source(source)
                .severity(severity)
                .ruleId(ruleId)
                .category(category)
                .kind(kind)
                .title(title)
                .message(message)
                .location(location)
                .confidence(confidence)
                .suggestion(suggestion)
                .createdAt(createdAt);
        builder.evidence.addAll(evidence);
        builder.tags.addAll(tags);
        builder.metrics.putAll(metrics);
        return builder;
    }

    /**
     * Builds the id {@code source:ruleId:hash8}, where hash8 is the first 8 hex chars of the MD5 of the
     * source, rule, location and discriminator. The same finding gets the same id on every run.
     */
    public static String stableId(IssueSource source, String ruleId, IssueLocation location, String discriminator) {
        String rule = ruleId != null ? ruleId : "none";
        String where = location == null ? "0__" : location.getPage() + "_"
                + (location.getSection() != null ? location.getSection() : "") + "_"
                + (location.getTable() != null ? location.getTable() : "");
        String raw = source.getKey() + ":" + rule + ":" + where + ":" + (discriminator != null ? discriminator : "");
        return source.getKey() + ":" + rule + ":" + md5Hex(raw).substring(0, 8);
    }

    private static String md5Hex(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public String getId() {
        return id;
    }

    public IssueSource getSource() {
        return source;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getCategory() {
        return category;
    }

    public IssueKind getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public List<Evidence> getEvidence() {
        return evidence;
    }

    public IssueLocation getLocation() {
        return location;
    }

    public double getConfidence() {
        return confidence;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getPage() {
        return location != null ? location.getPage() : 0;
    }

    @Override
    public String toString() {
        return "Issue{" + id + ", " + severity + ", " + title + "}";
    }

    public static class Builder {
        private String id;
        private IssueSource source;
        private Severity severity = Severity.MEDIUM;
        private String ruleId;
        private String category;
        private IssueKind kind = IssueKind.NARRATIVE;
        private String title;
        private String message;
        private final List<Evidence> evidence = new ArrayList<>();
        private IssueLocation location;
        private double confidence = 1.0;
        private final Set<String> tags = new TreeSet<>();
        private final Map<String, Double> metrics = new TreeMap<>();
        private String suggestion;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(IssueSource source) {
            this.source = source;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder kind(IssueKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder evidence(Evidence item) {
            this.evidence.add(item);
            return this;
        }

        public Builder clearEvidence() {
            this.evidence.clear();
            return this;
        }

        public Builder location(IssueLocation location) {
            this.location = location;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder metric(String name, double value) {
            this.metrics.put(name, value);
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Issue build() {
            if (source == null) {
                throw new IllegalStateException("Issue source is required");
            }
            if (id == null) {
                id = stableId(source, ruleId, location, title);
            }
            return new Issue(this);
        }
    }
}
