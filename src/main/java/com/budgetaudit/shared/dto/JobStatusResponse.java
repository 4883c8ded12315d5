package com.budgetaudit.shared.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for job status queries.
 */
public class JobStatusResponse {

    private String jobId;
    private String status;
    private String message;
    private ProgressInfo progress;
    private List<String> degradedDetectors = new ArrayList<>();

    public JobStatusResponse() {
    }

    public JobStatusResponse(String jobId, String status, String message) {
        this.jobId = jobId;
        this.status = status;
        this.message = message;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public ProgressInfo getProgress() {
        return progress;
    }

    public void setProgress(ProgressInfo progress) {
        this.progress = progress;
    }

    public List<String> getDegradedDetectors() {
        return degradedDetectors;
    }

    public void setDegradedDetectors(List<String> degradedDetectors) {
        this.degradedDetectors = degradedDetectors;
    }

    /**
     * Nested DTO for progress information.
     */
    public static class ProgressInfo {
        private String stage;
        private Integer percentComplete;

        public ProgressInfo() {
        }

        public ProgressInfo(String stage, Integer percentComplete) {
            this.stage = stage;
            this.percentComplete = percentComplete;
        }

        public String getStage() {
            return stage;
        }

        public void setStage(String stage) {
            this.stage = stage;
        }

        public Integer getPercentComplete() {
            return percentComplete;
        }

        public void setPercentComplete(Integer percentComplete) {
            this.percentComplete = percentComplete;
        }
    }
}
