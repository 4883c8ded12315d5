package com.budgetaudit.processing;

/**
 * Thrown when the result of a job that ended in error is requested.
 */
public class JobFailedException extends RuntimeException {

    private final String jobId;

    public JobFailedException(String jobId, String error) {
        super("Job " + jobId + " failed: " + error);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
