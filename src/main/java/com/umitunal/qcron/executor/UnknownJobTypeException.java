package com.umitunal.qcron.executor;

/**
 * Thrown when no handler is registered for a job type tag.
 */
public class UnknownJobTypeException extends Exception {
    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("Unknown job type: '" + jobType + "'");
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
