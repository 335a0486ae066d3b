package com.umitunal.qcron.executor;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps job type tags to their handlers.
 */
public class JobHandlerRegistry {
    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register a handler.
     *
     * @throws IllegalArgumentException if the tag is blank or already registered
     */
    public JobHandlerRegistry register(String jobType, JobHandler handler) {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType must not be blank");
        }
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(jobType, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for job type '" + jobType + "'");
        }
        return this;
    }

    public Optional<JobHandler> find(String jobType) {
        return Optional.ofNullable(lookup(jobType));
    }

    public JobHandler require(String jobType) throws UnknownJobTypeException {
        JobHandler handler = lookup(jobType);
        if (handler == null) {
            throw new UnknownJobTypeException(jobType);
        }
        return handler;
    }

    public boolean contains(String jobType) {
        return lookup(jobType) != null;
    }

    public Set<String> jobTypes() {
        return new TreeSet<>(handlers.keySet());
    }

    // ConcurrentHashMap rejects null keys; a missing tag is just an unknown type
    private JobHandler lookup(String jobType) {
        return jobType == null ? null : handlers.get(jobType);
    }
}
