package com.umitunal.qcron.scheduler;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.executor.JobExecutor;
import com.umitunal.qcron.trigger.CronExpression;
import com.umitunal.qcron.trigger.InvalidRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-instance control loop: polls the store for due jobs, leases them and hands them to the executor.
 *
 * Instances never talk to each other. Losing a lease race is expected and only counted.
 *
 * States cycle {@code IDLE -> POLLING -> DISPATCHING -> IDLE} for as long as the loop runs.
 */
public class SchedulerLoop implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

    private final JobStore store;
    private final JobExecutor executor;
    private final SchedulerConfig config;
    private final Clock clock;
    private final Object sigLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicLong pollCount = new AtomicLong(0);
    private final AtomicLong dispatchedCount = new AtomicLong(0);
    private final AtomicLong lostRaceCount = new AtomicLong(0);
    private final AtomicLong deferredCount = new AtomicLong(0);
    private final AtomicLong consecutiveFailures = new AtomicLong(0);

    private Thread loopThread;

    public SchedulerLoop(JobStore store, JobExecutor executor, SchedulerConfig config) {
        this.store = store;
        this.executor = executor;
        this.config = config;
        this.clock = config.getClock();
    }

    /**
     * Start polling in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::run, "SchedulerLoop-" + config.getInstanceId());
            loopThread.setDaemon(false);
            loopThread.start();
            logger.info("Scheduler loop {} started, polling every {}", config.getInstanceId(), config.getPollInterval());
        }
    }

    /**
     * Stop polling. Occurrences already dispatched keep running in the executor.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (sigLock) {
            sigLock.notifyAll();
        }
        if (loopThread != null) {
            try {
                loopThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Scheduler loop {} stopped", config.getInstanceId());
    }

    /**
     * Run one polling cycle synchronously.
     *
     * @return number of jobs leased and dispatched
     * @throws Exception if the store cannot be read; failures on single jobs are logged instead
     */
    public int pollOnce() throws Exception {
        state.set(State.POLLING);
        pollCount.incrementAndGet();
        Instant now = Instant.ofEpochMilli(clock.millis());

        List<ScheduledJob> candidates;
        try {
            candidates = store.dueJobs(now, config.getBatchSize());
        } catch (Exception e) {
            state.set(State.IDLE);
            throw e;
        }

        int dispatched = 0;
        try {
            for (int i = 0; i < candidates.size(); i++) {
                state.set(State.DISPATCHING);
                ScheduledJob job = candidates.get(i);

                if (!confirmDue(job, now)) {
                    continue;
                }

                if (!executor.tryReserve()) {
                    // No free worker: the rest stays due and is picked up by a later poll
                    int remaining = candidates.size() - i;
                    deferredCount.addAndGet(remaining);
                    logger.debug("Worker pool of {} full, deferring {} due job(s)", config.getInstanceId(), remaining);
                    break;
                }

                if (acquire(job)) {
                    executor.dispatch(job);
                    dispatched++;
                    dispatchedCount.incrementAndGet();
                } else {
                    executor.cancelReservation();
                }
            }
        } finally {
            state.set(State.IDLE);
        }
        return dispatched;
    }

    private boolean confirmDue(ScheduledJob job, Instant now) {
        CronExpression cron;
        try {
            cron = CronExpression.parse(job.getCronExpression(), config.getZone());
        } catch (InvalidRuleException e) {
            logger.warn("Skipping job {} with unparseable rule: {}", job.getId(), e.getMessage());
            return false;
        }
        if (cron.isDue(job.getNextFireAt(), now)) {
            return true;
        }
        if (job.getNextFireAt() != null && !job.getNextFireAt().isAfter(now)) {
            // Stored time was computed under another zone or an older rule; fire and let the reschedule correct it
            logger.warn("Job {} next fire time {} does not match rule '{}'", job.getId(), job.getNextFireAt(), cron);
            return true;
        }
        return false;
    }

    private boolean acquire(ScheduledJob job) {
        try {
            if (store.tryAcquire(job.getId(), config.getInstanceId(), config.getLeaseDuration())) {
                return true;
            }
            lostRaceCount.incrementAndGet();
            logger.debug("Job {} already leased by another instance", job.getId());
            return false;
        } catch (Exception e) {
            logger.warn("Could not lease job {}", job.getId(), e);
            return false;
        }
    }

    private void run() {
        while (running.get()) {
            long waitMillis;
            try {
                pollOnce();
                consecutiveFailures.set(0);
                waitMillis = config.getPollInterval().toMillis();
            } catch (Exception e) {
                long failures = consecutiveFailures.incrementAndGet();
                waitMillis = computeBackoff(failures).toMillis();
                logger.error("Polling failed {} time(s) in a row on {}, retrying in {} ms",
                        failures, config.getInstanceId(), waitMillis, e);
            }

            synchronized (sigLock) {
                if (!running.get()) {
                    break;
                }
                try {
                    sigLock.wait(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Delay before the next poll after {@code failures} consecutive store failures:
     * the poll interval doubled per failure, capped at the configured maximum.
     */
    Duration computeBackoff(long failures) {
        Duration delay = config.getPollInterval();
        for (long i = 1; i < failures && delay.compareTo(config.getMaxBackoff()) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(config.getMaxBackoff()) > 0 ? config.getMaxBackoff() : delay;
    }

    public State getState() { return state.get(); }
    public boolean isRunning() { return running.get(); }
    public long getPollCount() { return pollCount.get(); }
    public long getDispatchedCount() { return dispatchedCount.get(); }
    public long getLostRaceCount() { return lostRaceCount.get(); }
    public long getDeferredCount() { return deferredCount.get(); }
    public long getConsecutiveFailures() { return consecutiveFailures.get(); }

    @Override
    public void close() {
        stop();
    }

    /**
     * Phases of one polling cycle.
     */
    public enum State {
        IDLE,
        POLLING,
        DISPATCHING
    }
}
