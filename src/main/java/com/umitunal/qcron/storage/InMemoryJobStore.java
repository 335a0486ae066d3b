package com.umitunal.qcron.storage;

import com.umitunal.qcron.core.ExecutionOutcome;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.core.StoreMetrics;
import com.umitunal.qcron.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * JobStore kept in process memory. All reads and writes run under one monitor, which makes every
 * operation atomic; the shared table lives only as long as the JVM, so it coordinates scheduler
 * instances that run inside the same process.
 */
public class InMemoryJobStore implements JobStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryJobStore.class);

    private static final Comparator<JobRecord> BY_FIRE_TIME =
            Comparator.comparing(JobRecord::getNextFireAt).thenComparingLong(JobRecord::getId);

    private final Object lock = new Object();
    private final Map<Long, JobRecord> jobsById = new TreeMap<>();
    private final TreeSet<JobRecord> dueIndex = new TreeSet<>(BY_FIRE_TIME);
    private final Clock clock;
    private long nextId = 1;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
        logger.info("InMemoryJobStore initialized.");
    }

    @Override
    public ScheduledJob insert(ScheduledJob job) {
        synchronized (lock) {
            JobRecord row = JobRecord.newRow(nextId++, job);
            jobsById.put(row.getId(), row);
            index(row);
            return JobRecord.copyOf(row);
        }
    }

    @Override
    public ScheduledJob get(long jobId) {
        synchronized (lock) {
            JobRecord row = jobsById.get(jobId);
            return row != null ? JobRecord.copyOf(row) : null;
        }
    }

    @Override
    public List<ScheduledJob> list() {
        synchronized (lock) {
            List<ScheduledJob> result = new ArrayList<>(jobsById.size());
            for (JobRecord row : jobsById.values()) {
                result.add(JobRecord.copyOf(row));
            }
            return result;
        }
    }

    @Override
    public boolean update(ScheduledJob job) {
        synchronized (lock) {
            JobRecord row = jobsById.get(job.getId());
            if (row == null || row.getVersion() != job.getVersion()) {
                return false;
            }
            unindex(row);
            row.applyDefinition(job);
            index(row);
            return true;
        }
    }

    @Override
    public boolean delete(long jobId) {
        synchronized (lock) {
            JobRecord row = jobsById.remove(jobId);
            if (row == null) {
                return false;
            }
            unindex(row);
            return true;
        }
    }

    @Override
    public List<ScheduledJob> dueJobs(Instant now, int limit) {
        synchronized (lock) {
            List<ScheduledJob> due = new ArrayList<>();
            for (JobRecord row : dueIndex) {
                if (due.size() >= limit || row.getNextFireAt().isAfter(now)) {
                    break;
                }
                if (row.isEnabled() && row.isLeaseAvailable(now)) {
                    due.add(JobRecord.copyOf(row));
                }
            }
            return due;
        }
    }

    @Override
    public boolean tryAcquire(long jobId, String instanceId, Duration leaseDuration) {
        Instant now = Instant.ofEpochMilli(clock.millis());
        synchronized (lock) {
            JobRecord row = jobsById.get(jobId);
            if (row == null || !row.isDueAt(now) || !row.isLeaseAvailable(now)) {
                return false;
            }
            row.lease(instanceId, now.plus(leaseDuration));
            return true;
        }
    }

    @Override
    public boolean releaseAndReschedule(long jobId, String instanceId, ExecutionOutcome outcome, Instant nextFireAt) {
        synchronized (lock) {
            JobRecord row = jobsById.get(jobId);
            if (row == null || !instanceId.equals(row.getLockOwner())) {
                return false;
            }
            unindex(row);
            row.releaseAndReschedule(outcome, nextFireAt);
            index(row);
            return true;
        }
    }

    @Override
    public StoreMetrics getMetrics() {
        Instant now = Instant.ofEpochMilli(clock.millis());
        synchronized (lock) {
            return StoreMetricsCollector.collect(jobsById.values(), now);
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            jobsById.clear();
            dueIndex.clear();
        }
    }

    private void index(JobRecord row) {
        if (row.isEnabled() && row.getNextFireAt() != null) {
            dueIndex.add(row);
        }
    }

    // Must run before any change to the row's fire time, the comparator reads it
    private void unindex(JobRecord row) {
        if (row.getNextFireAt() != null) {
            dueIndex.remove(row);
        }
    }
}
