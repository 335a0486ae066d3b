package com.umitunal.qcron.service;

/**
 * Thrown when a management operation names a job id that does not exist.
 */
public class JobNotFoundException extends RuntimeException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
