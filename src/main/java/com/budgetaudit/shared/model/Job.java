package com.budgetaudit.shared.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of an audit job. Every read of a job returns a fresh snapshot; the live record
 * stays private to the orchestrator.
 */
public class Job {
    private final String id;
    private final JobStatus status;
    private final int progress;
    private final String documentId;
    private final String ruleSetVersion;
    private final MergedResult result;
    private final String error;
    private final Map<String, String> detectorErrors;
    private final List<String> degradedDetectors;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;

    public Job(String id, JobStatus status, int progress, String documentId, String ruleSetVersion,
               MergedResult result, String error, Map<String, String> detectorErrors,
               List<String> degradedDetectors, Map<String, Object> metadata, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.status = status;
        this.progress = progress;
        this.documentId = documentId;
        this.ruleSetVersion = ruleSetVersion;
        this.result = result;
        this.error = error;
        this.detectorErrors = Collections.unmodifiableMap(new LinkedHashMap<>(detectorErrors));
        this.degradedDetectors = Collections.unmodifiableList(new ArrayList<>(degradedDetectors));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getId() {
        return id;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getRuleSetVersion() {
        return ruleSetVersion;
    }

    public MergedResult getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public Map<String, String> getDetectorErrors() {
        return detectorErrors;
    }

    public List<String> getDegradedDetectors() {
        return degradedDetectors;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
