package com.umitunal.qcron.examples;

import com.umitunal.qcron.config.SchedulerConfig;
import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.executor.JobHandlerRegistry;
import com.umitunal.qcron.scheduler.SchedulerNode;
import com.umitunal.qcron.serialization.JsonCodec;
import com.umitunal.qcron.service.JobSpec;
import com.umitunal.qcron.storage.RocksJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Two scheduler instances sharing one store: each minute's occurrence runs on exactly one of them.
 */
public class TwoInstanceExample {
    private static final Logger logger = LoggerFactory.getLogger(TwoInstanceExample.class);

    public static void main(String[] args) throws Exception {
        String dataDir = args.length > 0 ? args[0] : "/tmp/qcron-example";
        long runSeconds = args.length > 1 ? Long.parseLong(args[1]) : 130;

        StorageConfig storage = StorageConfig.newBuilder(dataDir).build();
        JobHandlerRegistry registry = ExampleHandlers.registry();

        try (RocksJobStore store = new RocksJobStore(storage, JsonCodec.forPayloadMap(), Clock.systemUTC());
             SchedulerNode first = new SchedulerNode(store, registry, config("node-a"));
             SchedulerNode second = new SchedulerNode(store, registry, config("node-b"))) {

            ScheduledJob crunch = first.getService().createJob(
                    JobSpec.newBuilder("every minute sum", ExampleHandlers.NUMBER_CRUNCHING, "* * * * *")
                            .withParam("numbers", List.of(1, 2, 3.5))
                            .build());
            ScheduledJob email = first.getService().createJob(
                    JobSpec.newBuilder("monday digest", ExampleHandlers.EMAIL_NOTIFICATION, "0 9 * * MON")
                            .withParam("to", "team@example.com")
                            .withParam("subject", "Weekly digest")
                            .build());
            logger.info("Created {} and {}", crunch, email);

            first.start();
            second.start();
            Thread.sleep(Duration.ofSeconds(runSeconds).toMillis());

            for (ScheduledJob job : second.getService().listJobs()) {
                logger.info("{} runs={} last={} next={}", job.getName(), job.getRunCount(),
                        job.getLastStatus(), job.getNextFireAt());
            }
            logger.info("node-a executed {}, node-b executed {}, {}",
                    first.getExecutor().getExecutedCount(), second.getExecutor().getExecutedCount(), store.getMetrics());
        }
    }

    private static SchedulerConfig config(String instanceId) {
        return SchedulerConfig.newBuilder(instanceId, Duration.ofMinutes(2))
                .withPollInterval(Duration.ofSeconds(2))
                .withMaxExecutionTime(Duration.ofSeconds(30))
                .build();
    }
}
