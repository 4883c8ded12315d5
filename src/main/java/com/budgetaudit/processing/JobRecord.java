package com.budgetaudit.processing;

import com.budgetaudit.shared.model.Job;
import com.budgetaudit.shared.model.JobStatus;
import com.budgetaudit.shared.model.MergedResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live, mutable state of one job. Every mutation and every snapshot goes through the record's own lock,
 * so readers never observe a half-written result. Terminal states are never left.
 */
class JobRecord {

    private final ReentrantLock lock = new ReentrantLock();
    private final String id;
    private final String documentId;
    private final String ruleSetVersion;
    private final Instant createdAt;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final CompletableFuture<MergedResult> completion = new CompletableFuture<>();

    private JobStatus status = JobStatus.QUEUED;
    private final Set<JobStage> completedStages = EnumSet.noneOf(JobStage.class);
    private JobStage lastStage;
    private MergedResult result;
    private String error;
    private final Map<String, String> detectorErrors = new LinkedHashMap<>();
    private final List<String> degradedDetectors = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private Instant updatedAt;
    private Future<?> task;

    JobRecord(String id, String documentId, String ruleSetVersion, Instant now) {
        this.id = id;
        this.documentId = documentId;
        this.ruleSetVersion = ruleSetVersion;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * QUEUED to PROCESSING.
     *
     * @return false if the job already ended (cancelled while queued)
     */
    boolean start() {
        lock.lock();
        try {
            if (status != JobStatus.QUEUED) {
                return false;
            }
            status = JobStatus.PROCESSING;
            touch();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a stage as reached. Progress only grows: a stage counts once and terminal jobs are left alone.
     */
    void completeStage(JobStage stage) {
        lock.lock();
        try {
            if (status.isTerminal() || !completedStages.add(stage)) {
                return;
            }
            lastStage = stage;
            touch();
        } finally {
            lock.unlock();
        }
    }

    void recordDetectorFailure(String detector, String message) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return;
            }
            detectorErrors.put(detector, message);
            if (!degradedDetectors.contains(detector)) {
                degradedDetectors.add(detector);
            }
            touch();
        } finally {
            lock.unlock();
        }
    }

    void putMetadata(String key, Object value) {
        lock.lock();
        try {
            metadata.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * PROCESSING to DONE.
     *
     * @return false if the job had already ended
     */
    boolean complete(MergedResult mergedResult) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            result = mergedResult;
            completedStages.add(JobStage.MERGE);
            lastStage = JobStage.MERGE;
            status = JobStatus.DONE;
            touch();
        } finally {
            lock.unlock();
        }
        completion.complete(mergedResult);
        return true;
    }

    /**
     * Any non-terminal state to ERROR.
     *
     * @return false if the job had already ended
     */
    boolean fail(String message) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            error = message;
            status = JobStatus.ERROR;
            touch();
        } finally {
            lock.unlock();
        }
        completion.completeExceptionally(new JobFailedException(id, message));
        return true;
    }

    void setTask(Future<?> task) {
        lock.lock();
        try {
            this.task = task;
        } finally {
            lock.unlock();
        }
    }

    Future<?> getTask() {
        lock.lock();
        try {
            return task;
        } finally {
            lock.unlock();
        }
    }

    int progress() {
        lock.lock();
        try {
            if (status == JobStatus.DONE) {
                return 100;
            }
            int sum = 0;
            for (JobStage stage : completedStages) {
                sum += stage.getWeight();
            }
            return sum;
        } finally {
            lock.unlock();
        }
    }

    String stageLabel() {
        lock.lock();
        try {
            if (status == JobStatus.QUEUED || status.isTerminal() || lastStage == null) {
                return status.getKey();
            }
            return lastStage.getKey();
        } finally {
            lock.unlock();
        }
    }

    Job snapshot() {
        lock.lock();
        try {
            return new Job(id, status, progress(), documentId, ruleSetVersion, result, error,
                    detectorErrors, degradedDetectors, metadata, createdAt, updatedAt);
        } finally {
            lock.unlock();
        }
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    String getId() {
        return id;
    }

    CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    CompletableFuture<MergedResult> getCompletion() {
        return completion;
    }
}
