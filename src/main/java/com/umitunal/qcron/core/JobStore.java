package com.umitunal.qcron.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Shared persistent table of jobs and their schedule state. Every scheduler instance talks to the
 * same store; the two lease operations are the only writes that coordinate instances.
 *
 * Returned jobs are snapshots: mutating them has no effect on the store.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Store a new job and assign its id. Schedule state other than {@code enabled},
     * {@code nextFireAt} and {@code lastError} is reset.
     *
     * @return the stored snapshot carrying the assigned id
     */
    ScheduledJob insert(ScheduledJob job) throws Exception;

    /**
     * Get a job by id.
     *
     * @return the job, or null if no such job exists
     */
    ScheduledJob get(long jobId) throws Exception;

    /**
     * List all jobs ordered by id.
     */
    List<ScheduledJob> list() throws Exception;

    /**
     * Replace the definition fields, enabled flag, next fire time and last error of a job, only if
     * its version still equals {@code job.getVersion()}. Lease and run history are left untouched.
     *
     * @return true if written, false if the job changed or vanished since it was read
     */
    boolean update(ScheduledJob job) throws Exception;

    /**
     * Remove a job together with any lease it holds.
     *
     * @return true if the job existed
     */
    boolean delete(long jobId) throws Exception;

    /**
     * Enabled jobs whose next fire time is at or before {@code now} and that hold no live lease,
     * earliest first. A read, not a reservation.
     *
     * @param limit maximum number of jobs to return
     */
    List<ScheduledJob> dueJobs(Instant now, int limit) throws Exception;

    default List<ScheduledJob> dueJobs(Instant now) throws Exception {
        return dueJobs(now, Integer.MAX_VALUE);
    }

    /**
     * Atomically take the execution lease of a job, only if no live lease exists.
     *
     * @param instanceId identifier of the scheduler instance taking the lease
     * @param leaseDuration how long the lease stays valid from the store's current time
     * @return whether the lease was taken
     */
    boolean tryAcquire(long jobId, String instanceId, Duration leaseDuration) throws Exception;

    /**
     * Atomically clear the lease, record the outcome, increment the run count and set the next fire
     * time, only if {@code instanceId} still owns the lease. A disabled job keeps a null next fire time.
     *
     * @param nextFireAt next occurrence, or null if the rule is exhausted
     * @return false if the lease was lost; nothing is written in that case
     */
    boolean releaseAndReschedule(long jobId, String instanceId, ExecutionOutcome outcome, Instant nextFireAt)
            throws Exception;

    /**
     * Get statistics about the stored jobs.
     */
    StoreMetrics getMetrics() throws Exception;
}
