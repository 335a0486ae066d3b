package com.umitunal.qcron.scheduler;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.executor.JobExecutor;
import com.umitunal.qcron.executor.JobHandlerRegistry;
import com.umitunal.qcron.service.JobService;

/**
 * One scheduler instance: executor, polling loop and management service over a shared store.
 * Any number of nodes may run against the same store. The store is owned by the caller.
 */
public class SchedulerNode implements AutoCloseable {
    private final SchedulerConfig config;
    private final JobExecutor executor;
    private final SchedulerLoop loop;
    private final JobService service;

    public SchedulerNode(JobStore store, JobHandlerRegistry registry, SchedulerConfig config) {
        this.config = config;
        this.executor = new JobExecutor(store, registry, config);
        this.loop = new SchedulerLoop(store, executor, config);
        this.service = new JobService(store, registry, config.getClock(), config.getZone());
    }

    public void start() {
        loop.start();
    }

    public void stop() {
        loop.stop();
    }

    public String getInstanceId() { return config.getInstanceId(); }
    public SchedulerConfig getConfig() { return config; }
    public JobExecutor getExecutor() { return executor; }
    public SchedulerLoop getLoop() { return loop; }
    public JobService getService() { return service; }

    /**
     * Stop polling, then let in-flight occurrences finish.
     */
    @Override
    public void close() {
        loop.close();
        executor.close();
    }
}
