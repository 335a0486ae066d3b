package com.umitunal.qcron.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Partial change to a job. Fields left unset keep their stored value.
 */
public class JobUpdate {
    private final String name;
    private final String jobType;
    private final String cronExpression;
    private final Map<String, Object> params;
    private final Boolean enabled;

    private JobUpdate(Builder builder) {
        this.name = builder.name;
        this.jobType = builder.jobType;
        this.cronExpression = builder.cronExpression;
        this.params = builder.params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.params))
                : null;
        this.enabled = builder.enabled;
    }

    public Optional<String> getName() { return Optional.ofNullable(name); }
    public Optional<String> getJobType() { return Optional.ofNullable(jobType); }
    public Optional<String> getCronExpression() { return Optional.ofNullable(cronExpression); }
    public Optional<Map<String, Object>> getParams() { return Optional.ofNullable(params); }
    public Optional<Boolean> getEnabled() { return Optional.ofNullable(enabled); }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String jobType;
        private String cronExpression;
        private Map<String, Object> params;
        private Boolean enabled;

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withJobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder withCronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        /**
         * Replace the whole parameter map.
         */
        public Builder withParams(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(this);
        }
    }
}
