package com.umitunal.qcron.core;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Result of running one occurrence of a job.
 */
public final class ExecutionOutcome {
    public static final String TIMEOUT = "timeout";

    private final ScheduledJob.LastStatus status;
    private final Instant firedAt;
    private final Instant finishedAt;
    private final String errorDetail;
    private final Map<String, Object> result;
    private final int attempts;

    private ExecutionOutcome(ScheduledJob.LastStatus status, Instant firedAt, Instant finishedAt,
                             String errorDetail, Map<String, Object> result, int attempts) {
        this.status = status;
        this.firedAt = Objects.requireNonNull(firedAt, "firedAt");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
        this.errorDetail = errorDetail;
        this.result = result != null ? Collections.unmodifiableMap(result) : null;
        this.attempts = attempts;
    }

    public static ExecutionOutcome success(Instant firedAt, Instant finishedAt,
                                           Map<String, Object> result, int attempts) {
        return new ExecutionOutcome(ScheduledJob.LastStatus.SUCCESS, firedAt, finishedAt, null, result, attempts);
    }

    public static ExecutionOutcome failure(Instant firedAt, Instant finishedAt, String errorDetail, int attempts) {
        return new ExecutionOutcome(ScheduledJob.LastStatus.FAILURE, firedAt, finishedAt, errorDetail, null, attempts);
    }

    public ScheduledJob.LastStatus getStatus() { return status; }
    public Instant getFiredAt() { return firedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public String getErrorDetail() { return errorDetail; }
    public Map<String, Object> getResult() { return result; }
    public int getAttempts() { return attempts; }

    public boolean isSuccess() {
        return status == ScheduledJob.LastStatus.SUCCESS;
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(errorDetail);
    }

    @Override
    public String toString() {
        return String.format("ExecutionOutcome{status=%s, firedAt=%s, attempts=%d, error='%s'}",
                status, firedAt, attempts, errorDetail);
    }
}
