package com.umitunal.qcron.storage;

import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.core.StoreMetrics;

import java.time.Instant;

/**
 * Tallies store metrics over a sequence of rows.
 */
final class StoreMetricsCollector {
    private long total;
    private long enabled;
    private long disabled;
    private long locked;
    private long failing;
    private long neverRun;

    private StoreMetricsCollector() {
    }

    static StoreMetrics collect(Iterable<? extends ScheduledJob> jobs, Instant now) {
        StoreMetricsCollector collector = new StoreMetricsCollector();
        for (ScheduledJob job : jobs) {
            collector.add(job, now);
        }
        return collector.toMetrics();
    }

    static StoreMetricsCollector create() {
        return new StoreMetricsCollector();
    }

    void add(ScheduledJob job, Instant now) {
        total++;
        if (job.isEnabled()) {
            enabled++;
        } else {
            disabled++;
        }
        if (job.isLockedAt(now)) {
            locked++;
        }
        switch (job.getLastStatus()) {
            case FAILURE -> failing++;
            case NEVER_RUN -> neverRun++;
            default -> { }
        }
    }

    StoreMetrics toMetrics() {
        return new StoreMetrics(total, enabled, disabled, locked, failing, neverRun);
    }
}
