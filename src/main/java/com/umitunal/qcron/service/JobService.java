package com.umitunal.qcron.service;

import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.executor.JobHandlerRegistry;
import com.umitunal.qcron.executor.UnknownJobTypeException;
import com.umitunal.qcron.model.JobRecord;
import com.umitunal.qcron.trigger.CronExpression;
import com.umitunal.qcron.trigger.InvalidRuleException;
import com.umitunal.qcron.trigger.UnsatisfiableRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Management operations on job definitions, the layer an HTTP or RPC front end calls into.
 *
 * Rules and job types are validated before anything is written. Writes are compare-and-swap on the
 * job's version, so an edit never overwrites a lease or outcome committed by a scheduler instance.
 */
public class JobService {
    private static final Logger logger = LoggerFactory.getLogger(JobService.class);

    public static final String UNSATISFIABLE_PREFIX = "Unsatisfiable rule: ";
    private static final int MAX_UPDATE_ATTEMPTS = 5;

    private final JobStore store;
    private final JobHandlerRegistry registry;
    private final Clock clock;
    private final ZoneId zone;

    public JobService(JobStore store, JobHandlerRegistry registry, Clock clock, ZoneId zone) {
        this.store = store;
        this.registry = registry;
        this.clock = clock;
        this.zone = zone;
    }

    /**
     * Register a job and compute its first occurrence.
     *
     * A rule that can never fire does not fail the call: the job is stored disabled with
     * {@link ScheduledJob#getLastError()} explaining why.
     *
     * @return the stored job with its assigned id
     * @throws InvalidRuleException if the cron rule is malformed
     * @throws UnknownJobTypeException if no handler is registered for the job type
     */
    public ScheduledJob createJob(JobSpec spec) throws Exception {
        requireName(spec.getName());
        registry.require(spec.getJobType());
        CronExpression rule = CronExpression.parse(spec.getCronExpression(), zone);

        Instant now = now();
        JobRecord draft = new JobRecord(0, spec.getName(), spec.getJobType(), rule.toString(), spec.getParams(), now);
        if (spec.isEnabled()) {
            try {
                draft.enable(rule.nextFireAfter(now));
            } catch (UnsatisfiableRuleException e) {
                logger.warn("Job '{}' stored disabled: {}", spec.getName(), e.getMessage());
                draft.markUnschedulable(UNSATISFIABLE_PREFIX + e.getMessage());
            }
        } else {
            draft.disable();
        }

        ScheduledJob stored = store.insert(draft);
        logger.info("Created job {} '{}' type={} cron='{}' next={}",
                stored.getId(), stored.getName(), stored.getJobType(), stored.getCronExpression(), stored.getNextFireAt());
        return stored;
    }

    public Optional<ScheduledJob> getJob(long jobId) throws Exception {
        return Optional.ofNullable(store.get(jobId));
    }

    public List<ScheduledJob> listJobs() throws Exception {
        return store.list();
    }

    /**
     * Apply a partial update. The next fire time is recomputed from now when the rule changes or
     * the job is re-enabled.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws UnsatisfiableRuleException if the job is re-enabled with a rule that can never fire
     */
    public ScheduledJob updateJob(long jobId, JobUpdate update) throws Exception {
        if (update.getName().isPresent()) {
            requireName(update.getName().get());
        }
        if (update.getJobType().isPresent()) {
            registry.require(update.getJobType().get());
        }
        CronExpression newRule = null;
        if (update.getCronExpression().isPresent()) {
            newRule = CronExpression.parse(update.getCronExpression().get(), zone);
        }

        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            ScheduledJob current = store.get(jobId);
            if (current == null) {
                throw new JobNotFoundException(jobId);
            }

            JobRecord draft = JobRecord.copyOf(current);
            update.getName().ifPresent(draft::rename);
            update.getJobType().ifPresent(draft::changeJobType);
            update.getParams().ifPresent(draft::replaceParams);

            boolean ruleChanged = newRule != null && !newRule.toString().equals(current.getCronExpression());
            if (ruleChanged) {
                draft.changeCronExpression(newRule.toString());
            }

            boolean enable = update.getEnabled().orElse(current.isEnabled());
            boolean resuming = enable && !current.isEnabled();
            if (!enable) {
                draft.disable();
            } else if (resuming || ruleChanged) {
                CronExpression rule = newRule != null ? newRule : CronExpression.parse(current.getCronExpression(), zone);
                try {
                    draft.enable(rule.nextFireAfter(now()));
                    if (current.getLastError() != null && current.getLastError().startsWith(UNSATISFIABLE_PREFIX)) {
                        draft.clearLastError();
                    }
                } catch (UnsatisfiableRuleException e) {
                    if (resuming) {
                        throw e;
                    }
                    logger.warn("Job {} disabled by update: {}", jobId, e.getMessage());
                    draft.markUnschedulable(UNSATISFIABLE_PREFIX + e.getMessage());
                }
            }

            if (store.update(draft)) {
                ScheduledJob updated = store.get(jobId);
                logger.info("Updated job {}: enabled={} cron='{}' next={}", jobId,
                        draft.isEnabled(), draft.getCronExpression(), draft.getNextFireAt());
                return updated != null ? updated : draft;
            }
            logger.debug("Job {} changed concurrently, update attempt {} retried", jobId, attempt);
        }
        throw new IllegalStateException("Job " + jobId + " kept changing; update abandoned after "
                + MAX_UPDATE_ATTEMPTS + " attempts");
    }

    /**
     * Remove a job. An execution already in flight runs to completion; its outcome is dropped.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public void deleteJob(long jobId) throws Exception {
        if (!store.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        logger.info("Deleted job {}", jobId);
    }

    /**
     * Disable a job: it keeps its history but stops being due.
     */
    public ScheduledJob pauseJob(long jobId) throws Exception {
        return updateJob(jobId, JobUpdate.newBuilder().withEnabled(false).build());
    }

    /**
     * Re-enable a job, scheduling its next occurrence after now.
     */
    public ScheduledJob resumeJob(long jobId) throws Exception {
        return updateJob(jobId, JobUpdate.newBuilder().withEnabled(true).build());
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.millis());
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank");
        }
    }
}
