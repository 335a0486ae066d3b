package com.umitunal.qcron.core;

import java.time.Instant;
import java.util.Map;

/**
 * A registered job definition together with its scheduling and execution state.
 */
public interface ScheduledJob {

    /**
     * Gets the unique identifier assigned when the job was stored.
     */
    long getId();

    /**
     * Gets the human-readable name.
     */
    String getName();

    /**
     * Gets the tag selecting the handler that runs this job.
     */
    String getJobType();

    /**
     * Gets the five-field cron rule.
     */
    String getCronExpression();

    /**
     * Gets the parameters passed verbatim to the handler.
     */
    Map<String, Object> getParams();

    boolean isEnabled();

    /**
     * Gets the next occurrence, or null when the job is disabled or its rule is exhausted.
     */
    Instant getNextFireAt();

    /**
     * Gets the instant the last occurrence started executing, or null if never fired.
     */
    Instant getLastFiredAt();

    LastStatus getLastStatus();

    /**
     * Gets the error detail of the latest outcome, or the reason the job could not be scheduled.
     */
    String getLastError();

    /**
     * Gets the result payload returned by the latest successful run, if any.
     */
    Map<String, Object> getLastResult();

    long getRunCount();

    /**
     * Gets the instance currently holding the execution lease, or null.
     */
    String getLockOwner();

    /**
     * Gets the lease expiry, or null when no lease was ever taken.
     */
    Instant getLockExpiry();

    Instant getCreatedAt();

    /**
     * Gets the write counter used for compare-and-swap updates.
     */
    long getVersion();

    /**
     * Checks whether a lease is held and has not expired at {@code now}.
     */
    default boolean isLockedAt(Instant now) {
        return getLockOwner() != null && getLockExpiry() != null && !now.isAfter(getLockExpiry());
    }

    /**
     * Outcome of the most recent execution.
     */
    enum LastStatus {
        NEVER_RUN,
        SUCCESS,
        FAILURE
    }
}
