package com.umitunal.qcron.model;

import com.umitunal.qcron.core.ExecutionOutcome;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.serialization.PayloadCodec;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable job row as held by a store. Store-side transitions bump the version.
 */
public class JobRecord implements ScheduledJob {
    private final long id;
    private String name;
    private String jobType;
    private String cronExpression;
    private Map<String, Object> params;
    private final Instant createdAt;

    private boolean enabled;
    private Instant nextFireAt;
    private Instant lastFiredAt;
    private LastStatus lastStatus;
    private String lastError;
    private Map<String, Object> lastResult;
    private long runCount;
    private String lockOwner;
    private Instant lockExpiry;
    private long version;

    public JobRecord(long id, String name, String jobType, String cronExpression,
                     Map<String, Object> params, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.jobType = jobType;
        this.cronExpression = cronExpression;
        this.params = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
        this.createdAt = createdAt;
        this.enabled = true;
        this.lastStatus = LastStatus.NEVER_RUN;
        this.runCount = 0;
        this.version = 0;
    }

    /**
     * Deep enough copy for handing out snapshots: maps are copied, values are shared.
     */
    public static JobRecord copyOf(ScheduledJob job) {
        JobRecord copy = new JobRecord(job.getId(), job.getName(), job.getJobType(),
                job.getCronExpression(), job.getParams(), job.getCreatedAt());
        copy.enabled = job.isEnabled();
        copy.nextFireAt = job.getNextFireAt();
        copy.lastFiredAt = job.getLastFiredAt();
        copy.lastStatus = job.getLastStatus();
        copy.lastError = job.getLastError();
        copy.lastResult = job.getLastResult() != null ? new LinkedHashMap<>(job.getLastResult()) : null;
        copy.runCount = job.getRunCount();
        copy.lockOwner = job.getLockOwner();
        copy.lockExpiry = job.getLockExpiry();
        copy.version = job.getVersion();
        return copy;
    }

    /**
     * Fresh row for {@code job} under a newly assigned id, with run history and lease reset.
     */
    public static JobRecord newRow(long id, ScheduledJob job) {
        JobRecord row = new JobRecord(id, job.getName(), job.getJobType(), job.getCronExpression(),
                job.getParams(), job.getCreatedAt());
        row.enabled = job.isEnabled();
        row.nextFireAt = job.isEnabled() ? job.getNextFireAt() : null;
        row.lastError = job.getLastError();
        return row;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getJobType() {
        return jobType;
    }

    @Override
    public String getCronExpression() {
        return cronExpression;
    }

    @Override
    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Instant getNextFireAt() {
        return nextFireAt;
    }

    @Override
    public Instant getLastFiredAt() {
        return lastFiredAt;
    }

    @Override
    public LastStatus getLastStatus() {
        return lastStatus;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    @Override
    public Map<String, Object> getLastResult() {
        return lastResult != null ? Collections.unmodifiableMap(lastResult) : null;
    }

    @Override
    public long getRunCount() {
        return runCount;
    }

    @Override
    public String getLockOwner() {
        return lockOwner;
    }

    @Override
    public Instant getLockExpiry() {
        return lockExpiry;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public long getVersion() {
        return version;
    }

    // Package-private setters for deserialization
    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    void setNextFireAt(Instant nextFireAt) {
        this.nextFireAt = nextFireAt;
    }

    void setLastFiredAt(Instant lastFiredAt) {
        this.lastFiredAt = lastFiredAt;
    }

    void setLastStatus(LastStatus lastStatus) {
        this.lastStatus = lastStatus;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void setLastResult(Map<String, Object> lastResult) {
        this.lastResult = lastResult;
    }

    void setRunCount(long runCount) {
        this.runCount = runCount;
    }

    void setLockOwner(String lockOwner) {
        this.lockOwner = lockOwner;
    }

    void setLockExpiry(Instant lockExpiry) {
        this.lockExpiry = lockExpiry;
    }

    void setVersion(long version) {
        this.version = version;
    }

    /**
     * Whether a new lease may be taken at {@code now}.
     */
    public boolean isLeaseAvailable(Instant now) {
        return lockOwner == null || lockExpiry == null || now.isAfter(lockExpiry);
    }

    public boolean isDueAt(Instant now) {
        return enabled && nextFireAt != null && !nextFireAt.isAfter(now);
    }

    public void lease(String instanceId, Instant expiry) {
        this.lockOwner = instanceId;
        this.lockExpiry = expiry;
        this.version++;
    }

    public void releaseAndReschedule(ExecutionOutcome outcome, Instant next) {
        this.lockOwner = null;
        this.lockExpiry = null;
        this.lastFiredAt = outcome.getFiredAt();
        this.lastStatus = outcome.getStatus();
        this.lastError = outcome.getErrorDetail();
        this.lastResult = outcome.getResult() != null ? new LinkedHashMap<>(outcome.getResult()) : null;
        this.runCount++;
        this.nextFireAt = enabled ? next : null;
        this.version++;
    }

    /**
     * Copy the fields a management update may change, keeping lease and run history.
     */
    public void applyDefinition(ScheduledJob source) {
        this.name = source.getName();
        this.jobType = source.getJobType();
        this.cronExpression = source.getCronExpression();
        this.params = new LinkedHashMap<>(source.getParams());
        this.enabled = source.isEnabled();
        this.nextFireAt = source.isEnabled() ? source.getNextFireAt() : null;
        this.lastError = source.getLastError();
        this.version++;
    }

    // The mutators below edit a draft that is written back through JobStore#update,
    // so they leave the version alone for the compare-and-swap.
    public void disable() {
        this.enabled = false;
        this.nextFireAt = null;
    }

    public void enable(Instant next) {
        this.enabled = true;
        this.nextFireAt = next;
    }

    public void clearLastError() {
        this.lastError = null;
    }

    public void rename(String newName) {
        this.name = newName;
    }

    public void changeCronExpression(String newCronExpression) {
        this.cronExpression = newCronExpression;
    }

    public void replaceParams(Map<String, Object> newParams) {
        this.params = new LinkedHashMap<>(newParams);
    }

    public void changeJobType(String newJobType) {
        this.jobType = newJobType;
    }

    public void markUnschedulable(String reason) {
        this.enabled = false;
        this.nextFireAt = null;
        this.lastError = reason;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id=%d, name='%s', type='%s', cron='%s', enabled=%s, next=%s, runs=%d, owner='%s'}",
                id, name, jobType, cronExpression, enabled, nextFireAt, runCount, lockOwner);
    }

    /**
     * Serialize to bytes for storage.
     * Delegates to JobRecordSerializer for actual serialization logic.
     */
    public byte[] serialize(PayloadCodec<Map<String, Object>> codec) {
        return new JobRecordSerializer(codec).serialize(this);
    }

    /**
     * Deserialize from bytes.
     * Delegates to JobRecordSerializer for actual deserialization logic.
     */
    public static JobRecord deserialize(byte[] bytes, PayloadCodec<Map<String, Object>> codec) {
        return new JobRecordSerializer(codec).deserialize(bytes);
    }

    /**
     * Create storage key for a job row: the id as 8 big-endian bytes.
     */
    public static byte[] createStorageKey(long jobId) {
        return ByteBuffer.allocate(8).putLong(jobId).array();
    }

    /**
     * Create due-index key.
     * Format: [nextFireAt millis(8 bytes)][jobId(8 bytes)]
     * Keys sort by fire time, so a scan can stop at the first entry in the future.
     */
    public static byte[] createDueIndexKey(Instant nextFireAt, long jobId) {
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(nextFireAt.toEpochMilli());
        buffer.putLong(jobId);
        return buffer.array();
    }

    public static long dueIndexFireTime(byte[] indexKey) {
        return ByteBuffer.wrap(indexKey).getLong(0);
    }

    public static long dueIndexJobId(byte[] indexKey) {
        return ByteBuffer.wrap(indexKey).getLong(8);
    }
}
