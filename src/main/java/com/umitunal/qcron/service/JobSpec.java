package com.umitunal.qcron.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Definition of a new job as submitted through the management API.
 */
public class JobSpec {
    private final String name;
    private final String jobType;
    private final String cronExpression;
    private final Map<String, Object> params;
    private final boolean enabled;

    private JobSpec(Builder builder) {
        this.name = builder.name;
        this.jobType = builder.jobType;
        this.cronExpression = builder.cronExpression;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.enabled = builder.enabled;
    }

    public String getName() { return name; }
    public String getJobType() { return jobType; }
    public String getCronExpression() { return cronExpression; }
    public Map<String, Object> getParams() { return params; }
    public boolean isEnabled() { return enabled; }

    public static Builder newBuilder(String name, String jobType, String cronExpression) {
        return new Builder(name, jobType, cronExpression);
    }

    public static class Builder {
        private final String name;
        private final String jobType;
        private final String cronExpression;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private boolean enabled = true;

        private Builder(String name, String jobType, String cronExpression) {
            this.name = name;
            this.jobType = jobType;
            this.cronExpression = cronExpression;
        }

        public Builder withParams(Map<String, Object> params) {
            this.params.putAll(params);
            return this;
        }

        public Builder withParam(String key, Object value) {
            this.params.put(key, value);
            return this;
        }

        /**
         * Create the job paused.
         * Default: enabled
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public JobSpec build() {
            return new JobSpec(this);
        }
    }
}
