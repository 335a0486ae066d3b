package com.umitunal.qcron.executor;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.core.ExecutionOutcome;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.trigger.CronExpression;
import com.umitunal.qcron.trigger.InvalidRuleException;
import com.umitunal.qcron.trigger.UnsatisfiableRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs leased occurrences on a bounded worker pool and writes their outcome back to the store.
 *
 * Capacity is handed out as permits: the scheduler loop reserves one with {@link #tryReserve()}
 * before leasing a job and either dispatches the job or cancels the reservation. Handlers run on
 * separate handler threads so a worker can stop waiting on one that exceeds the maximum execution time.
 */
public class JobExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JobExecutor.class);

    private final JobStore store;
    private final JobHandlerRegistry registry;
    private final SchedulerConfig config;
    private final Clock clock;
    private final Semaphore permits;
    private final ThreadPoolExecutor workers;
    private final ExecutorService handlerThreads;
    private final AtomicLong executedCount = new AtomicLong(0);
    private final AtomicLong succeededCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong lostLockCount = new AtomicLong(0);

    public JobExecutor(JobStore store, JobHandlerRegistry registry, SchedulerConfig config) {
        this.store = store;
        this.registry = registry;
        this.config = config;
        this.clock = config.getClock();
        this.permits = new Semaphore(config.getWorkerPoolSize());
        this.workers = new ThreadPoolExecutor(
                config.getWorkerPoolSize(),
                config.getWorkerPoolSize(),
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                namedThreads("qcron-worker-" + config.getInstanceId()));
        this.handlerThreads = Executors.newCachedThreadPool(namedThreads("qcron-handler-" + config.getInstanceId()));
    }

    /**
     * Reserve capacity for one occurrence.
     *
     * @return false when every worker is busy
     */
    public boolean tryReserve() {
        return permits.tryAcquire();
    }

    /**
     * Give back a reservation that will not be dispatched.
     */
    public void cancelReservation() {
        permits.release();
    }

    public int availableCapacity() {
        return permits.availablePermits();
    }

    /**
     * Execute a leased job on a worker thread, consuming a reservation made with {@link #tryReserve()}.
     */
    public void dispatch(ScheduledJob job) {
        try {
            workers.execute(() -> {
                try {
                    execute(job);
                } catch (RuntimeException e) {
                    logger.error("Unexpected error executing job {}", job.getId(), e);
                } finally {
                    permits.release();
                }
            });
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Run the job's handler, then release its lease and move it to the next occurrence.
     * Handler failures are recorded, never thrown.
     *
     * @return the outcome recorded for this occurrence
     */
    public ExecutionOutcome execute(ScheduledJob job) {
        ExecutionOutcome outcome = runHandler(job);
        executedCount.incrementAndGet();
        if (outcome.isSuccess()) {
            succeededCount.incrementAndGet();
            logger.info("Job {} '{}' succeeded after {} attempt(s)", job.getId(), job.getName(), outcome.getAttempts());
        } else {
            failedCount.incrementAndGet();
            logger.warn("Job {} '{}' failed after {} attempt(s): {}",
                    job.getId(), job.getName(), outcome.getAttempts(), outcome.getErrorDetail());
        }
        reschedule(job, outcome);
        return outcome;
    }

    /**
     * Run the handler with retries, without touching the store.
     */
    ExecutionOutcome runHandler(ScheduledJob job) {
        Instant firedAt = Instant.ofEpochMilli(clock.millis());

        JobHandler handler;
        try {
            handler = registry.require(job.getJobType());
        } catch (UnknownJobTypeException e) {
            // Permanent for this job: retrying cannot help
            return ExecutionOutcome.failure(firedAt, now(), e.getMessage(), 1);
        }

        String lastError = null;
        for (int attempt = 1; attempt <= config.getMaxAttempts(); attempt++) {
            if (attempt > 1 && !pause()) {
                return ExecutionOutcome.failure(firedAt, now(), "interrupted", attempt - 1);
            }

            Future<JobHandler.Result> future = handlerThreads.submit(() -> handler.handle(job.getParams()));
            try {
                JobHandler.Result result = future.get(config.getMaxExecutionTime().toMillis(), TimeUnit.MILLISECONDS);
                if (result == null || result.isSuccess()) {
                    return ExecutionOutcome.success(firedAt, now(), result != null ? result.getPayload() : null, attempt);
                }
                lastError = result.getMessage();
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = ExecutionOutcome.TIMEOUT;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                lastError = describe(cause);
                logger.debug("Job {} attempt {} threw", job.getId(), attempt, cause);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return ExecutionOutcome.failure(firedAt, now(), "interrupted", attempt);
            }

            if (attempt < config.getMaxAttempts()) {
                logger.info("Job {} attempt {}/{} failed: {}", job.getId(), attempt, config.getMaxAttempts(), lastError);
            }
        }
        return ExecutionOutcome.failure(firedAt, now(), lastError, config.getMaxAttempts());
    }

    private void reschedule(ScheduledJob job, ExecutionOutcome outcome) {
        try {
            // The rule may have been edited while the handler ran
            ScheduledJob current = store.get(job.getId());
            if (current == null) {
                logger.info("Job {} was deleted while running; outcome {} dropped", job.getId(), outcome.getStatus());
                return;
            }
            Instant next = nextFireTime(current, outcome.getFiredAt());
            boolean released = store.releaseAndReschedule(job.getId(), config.getInstanceId(), outcome, next);
            if (!released) {
                lostLockCount.incrementAndGet();
                logger.warn("Lost lease on job {} before reschedule; outcome {} discarded", job.getId(), outcome.getStatus());
            } else {
                logger.debug("Job {} rescheduled for {}", job.getId(), next);
            }
        } catch (Exception e) {
            // The lease expires on its own and another instance picks the occurrence up again
            logger.error("Could not reschedule job {}", job.getId(), e);
        }
    }

    private Instant nextFireTime(ScheduledJob job, Instant firedAt) {
        try {
            return CronExpression.parse(job.getCronExpression(), config.getZone()).nextFireAfter(firedAt);
        } catch (InvalidRuleException | UnsatisfiableRuleException e) {
            logger.error("Job {} has no next occurrence: {}", job.getId(), e.getMessage());
            return null;
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(config.getRetryDelay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.millis());
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null
                ? error.getClass().getSimpleName() + ": " + message
                : error.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public long getExecutedCount() { return executedCount.get(); }
    public long getSucceededCount() { return succeededCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getLostLockCount() { return lostLockCount.get(); }

    /**
     * Stop accepting work and wait up to the maximum execution time for running occurrences.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getMaxExecutionTime().toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                logger.warn("Workers of {} still busy at shutdown", config.getInstanceId());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        handlerThreads.shutdownNow();
    }
}
