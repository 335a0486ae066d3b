package com.umitunal.qcron.storage;

import com.umitunal.qcron.MutableClock;
import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.core.ExecutionOutcome;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.serialization.JsonCodec;
import com.umitunal.qcron.serialization.KryoCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RocksJobStoreTest extends AbstractJobStoreTest {

    @TempDir
    Path tempDir;

    private StorageConfig storageConfig() {
        return StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build();
    }

    @Override
    protected JobStore createStore(MutableClock clock) throws Exception {
        return new RocksJobStore(storageConfig(), JsonCodec.forPayloadMap(), clock);
    }

    @Test
    @DisplayName("Jobs, leases and the id sequence survive a restart")
    void testRecoveryAfterRestart() throws Exception {
        // Given
        ScheduledJob leased = insertDue("leased", Instant.parse("2024-01-01T00:00:00Z"));
        ScheduledJob waiting = insertDue("waiting", Instant.parse("2024-01-01T00:00:10Z"));
        assertThat(store.tryAcquire(leased.getId(), "node-a", LEASE)).isTrue();

        // When
        store.close();
        store = createStore(clock);

        // Then
        assertThat(store.list()).hasSize(2);
        assertThat(store.get(leased.getId()).getLockOwner()).isEqualTo("node-a");
        assertThat(store.dueJobs(clock.instant())).extracting(ScheduledJob::getId)
                .containsExactly(waiting.getId());

        ScheduledJob next = insertDue("after-restart", Instant.parse("2024-01-01T00:01:00Z"));
        assertThat(next.getId()).isGreaterThan(waiting.getId());
    }

    @Test
    @DisplayName("Due scan stops at the first future entry and skips stale index keys")
    void testDueScanWithManyJobs() throws Exception {
        // Given
        for (int i = 0; i < 50; i++) {
            insertDue("past-" + i, Instant.parse("2024-01-01T00:00:00Z").minusSeconds(i));
            insertDue("future-" + i, Instant.parse("2024-01-01T00:01:00Z").plusSeconds(i));
        }

        // When
        List<ScheduledJob> due = store.dueJobs(clock.instant());

        // Then
        assertThat(due).hasSize(50);
        assertThat(due).extracting(ScheduledJob::getNextFireAt).isSorted();
        assertThat(due).allMatch(job -> job.getName().startsWith("past-"));
    }

    @Test
    @DisplayName("Kryo-encoded parameters and results round trip through the store")
    void testKryoPayloads() throws Exception {
        // Given
        store.close();
        store = new RocksJobStore(storageConfig(), KryoCodec.forPayloadMap(), clock);
        ScheduledJob job = store.insert(draft("kryo", "* * * * *", Instant.parse("2024-01-01T00:00:00Z")));

        // When
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isTrue();
        store.releaseAndReschedule(job.getId(), "node-a",
                ExecutionOutcome.success(clock.instant(), clock.instant(), Map.of("count", 3, "sum", 6L), 1),
                Instant.parse("2024-01-01T00:01:00Z"));

        // Then
        ScheduledJob after = store.get(job.getId());
        assertThat(after.getParams()).containsEntry("to", "kryo@example.com");
        assertThat(after.getLastResult()).containsEntry("count", 3).containsEntry("sum", 6L);
    }
}
