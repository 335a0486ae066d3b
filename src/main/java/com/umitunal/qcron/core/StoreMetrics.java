package com.umitunal.qcron.core;

/**
 * Snapshot counts of the jobs held by a store.
 */
public class StoreMetrics {
    private final long totalJobs;
    private final long enabledJobs;
    private final long disabledJobs;
    private final long lockedJobs;
    private final long failingJobs;
    private final long neverRunJobs;

    public StoreMetrics(long totalJobs, long enabledJobs, long disabledJobs,
                        long lockedJobs, long failingJobs, long neverRunJobs) {
        this.totalJobs = totalJobs;
        this.enabledJobs = enabledJobs;
        this.disabledJobs = disabledJobs;
        this.lockedJobs = lockedJobs;
        this.failingJobs = failingJobs;
        this.neverRunJobs = neverRunJobs;
    }

    public long getTotalJobs() { return totalJobs; }
    public long getEnabledJobs() { return enabledJobs; }
    public long getDisabledJobs() { return disabledJobs; }
    public long getLockedJobs() { return lockedJobs; }
    public long getFailingJobs() { return failingJobs; }
    public long getNeverRunJobs() { return neverRunJobs; }

    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{total=%d, enabled=%d, disabled=%d, locked=%d, failing=%d, neverRun=%d}",
            totalJobs, enabledJobs, disabledJobs, lockedJobs, failingJobs, neverRunJobs
        );
    }
}
