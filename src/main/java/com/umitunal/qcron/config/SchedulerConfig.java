package com.umitunal.qcron.config;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Settings of one scheduler instance.
 *
 * The lease duration has no default: it must be chosen against the worst-case handler runtime.
 * {@link Builder#build()} rejects a lease that does not cover every attempt of an occurrence
 * plus the clock skew tolerated between instances.
 */
public class SchedulerConfig {
    private final String instanceId;
    private final Duration leaseDuration;
    private final Duration pollInterval;
    private final Duration maxExecutionTime;
    private final Duration clockSkewTolerance;
    private final Duration maxBackoff;
    private final Duration retryDelay;
    private final int workerPoolSize;
    private final int maxAttempts;
    private final int batchSize;
    private final ZoneId zone;
    private final Clock clock;

    private SchedulerConfig(Builder builder) {
        this.instanceId = builder.instanceId;
        this.leaseDuration = builder.leaseDuration;
        this.pollInterval = builder.pollInterval;
        this.maxExecutionTime = builder.maxExecutionTime;
        this.clockSkewTolerance = builder.clockSkewTolerance;
        this.maxBackoff = builder.maxBackoff;
        this.retryDelay = builder.retryDelay;
        this.workerPoolSize = builder.workerPoolSize;
        this.maxAttempts = builder.maxAttempts;
        this.batchSize = builder.batchSize;
        this.zone = builder.zone;
        this.clock = builder.clock;
    }

    public String getInstanceId() { return instanceId; }
    public Duration getLeaseDuration() { return leaseDuration; }
    public Duration getPollInterval() { return pollInterval; }
    public Duration getMaxExecutionTime() { return maxExecutionTime; }
    public Duration getClockSkewTolerance() { return clockSkewTolerance; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public Duration getRetryDelay() { return retryDelay; }
    public int getWorkerPoolSize() { return workerPoolSize; }
    public int getMaxAttempts() { return maxAttempts; }
    public int getBatchSize() { return batchSize; }
    public ZoneId getZone() { return zone; }
    public Clock getClock() { return clock; }

    /**
     * Longest time one occurrence may keep its lease busy: every attempt timing out,
     * separated by retry delays.
     */
    public Duration worstCaseOccurrenceTime() {
        return maxExecutionTime.multipliedBy(maxAttempts)
                .plus(retryDelay.multipliedBy(maxAttempts - 1L));
    }

    public static Builder newBuilder(String instanceId, Duration leaseDuration) {
        return new Builder(instanceId, leaseDuration);
    }

    @Override
    public String toString() {
        return String.format("SchedulerConfig{instance='%s', lease=%s, poll=%s, maxExecution=%s, workers=%d, attempts=%d}",
                instanceId, leaseDuration, pollInterval, maxExecutionTime, workerPoolSize, maxAttempts);
    }

    public static class Builder {
        private final String instanceId;
        private final Duration leaseDuration;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration maxExecutionTime = Duration.ofSeconds(60);
        private Duration clockSkewTolerance = Duration.ofSeconds(5);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private Duration retryDelay = Duration.ofSeconds(1);
        private int workerPoolSize = 4;
        private int maxAttempts = 1;
        private int batchSize = 100;
        private ZoneId zone = ZoneOffset.UTC;
        private Clock clock = Clock.systemUTC();

        private Builder(String instanceId, Duration leaseDuration) {
            this.instanceId = instanceId;
            this.leaseDuration = leaseDuration;
        }

        /**
         * Time between polls of the store.
         * Default: 5 seconds
         */
        public Builder withPollInterval(Duration interval) {
            this.pollInterval = Objects.requireNonNull(interval);
            return this;
        }

        /**
         * Time after which a running handler is abandoned and the attempt recorded as a timeout.
         * Default: 60 seconds
         */
        public Builder withMaxExecutionTime(Duration maxExecutionTime) {
            this.maxExecutionTime = Objects.requireNonNull(maxExecutionTime);
            return this;
        }

        /**
         * Largest clock difference expected between instances.
         * Default: 5 seconds
         */
        public Builder withClockSkewTolerance(Duration tolerance) {
            this.clockSkewTolerance = Objects.requireNonNull(tolerance);
            return this;
        }

        /**
         * Upper bound of the polling back-off after store failures.
         * Default: 60 seconds
         */
        public Builder withMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = Objects.requireNonNull(maxBackoff);
            return this;
        }

        /**
         * Pause between attempts of the same occurrence.
         * Default: 1 second
         */
        public Builder withRetryDelay(Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay);
            return this;
        }

        /**
         * Maximum number of occurrences executing at once on this instance.
         * Default: 4
         */
        public Builder withWorkerPoolSize(int size) {
            this.workerPoolSize = size;
            return this;
        }

        /**
         * Attempts per occurrence before the failure is recorded.
         * Default: 1 (record and move on to the next occurrence)
         */
        public Builder withMaxAttempts(int attempts) {
            this.maxAttempts = attempts;
            return this;
        }

        /**
         * Maximum number of due jobs read per poll.
         * Default: 100
         */
        public Builder withBatchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Zone in which cron fields are evaluated.
         * Default: UTC
         */
        public Builder withZone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone);
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public SchedulerConfig build() {
            if (instanceId == null || instanceId.isBlank()) {
                throw new IllegalArgumentException("instanceId is required");
            }
            if (leaseDuration == null || leaseDuration.isNegative() || leaseDuration.isZero()) {
                throw new IllegalArgumentException("leaseDuration must be positive");
            }
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            if (maxExecutionTime.isNegative() || maxExecutionTime.isZero()) {
                throw new IllegalArgumentException("maxExecutionTime must be positive");
            }
            if (workerPoolSize < 1) {
                throw new IllegalArgumentException("workerPoolSize must be at least 1");
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be at least 1");
            }
            SchedulerConfig config = new SchedulerConfig(this);
            Duration required = config.worstCaseOccurrenceTime().plus(clockSkewTolerance);
            if (leaseDuration.compareTo(required) <= 0) {
                throw new IllegalArgumentException("leaseDuration " + leaseDuration
                        + " must exceed worst-case occurrence time plus clock skew (" + required + ")");
            }
            return config;
        }
    }
}
