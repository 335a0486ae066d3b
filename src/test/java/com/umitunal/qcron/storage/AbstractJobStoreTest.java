package com.umitunal.qcron.storage;

import com.umitunal.qcron.MutableClock;
import com.umitunal.qcron.core.ExecutionOutcome;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.core.StoreMetrics;
import com.umitunal.qcron.model.JobRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Behaviour every JobStore must share. Subclasses only provide the store.
 */
abstract class AbstractJobStoreTest {
    static final Duration LEASE = Duration.ofMinutes(2);

    protected MutableClock clock;
    protected JobStore store;

    protected abstract JobStore createStore(MutableClock clock) throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        clock = MutableClock.at("2024-01-01T00:00:30Z");
        store = createStore(clock);
    }

    @AfterEach
    void tearDownStore() throws Exception {
        if (store != null) {
            store.close();
        }
    }

    protected JobRecord draft(String name, String cron, Instant next) {
        JobRecord job = new JobRecord(0, name, "email_notification", cron,
                Map.of("to", name + "@example.com"), clock.instant());
        if (next != null) {
            job.enable(next);
        } else {
            job.disable();
        }
        return job;
    }

    protected ScheduledJob insertDue(String name, Instant next) throws Exception {
        return store.insert(draft(name, "* * * * *", next));
    }

    private static ExecutionOutcome success(Instant firedAt) {
        return ExecutionOutcome.success(firedAt, firedAt.plusSeconds(1), Map.of("sent", true), 1);
    }

    @Test
    @DisplayName("Insert assigns increasing ids and get returns the stored fields")
    void testInsertAndGet() throws Exception {
        // Given
        ScheduledJob first = insertDue("first", Instant.parse("2024-01-01T00:01:00Z"));
        ScheduledJob second = store.insert(draft("second", "0 9 * * 1", null));

        // When
        ScheduledJob loaded = store.get(first.getId());

        // Then
        assertThat(second.getId()).isGreaterThan(first.getId());
        assertThat(loaded).isNotNull();
        assertThat(loaded.getName()).isEqualTo("first");
        assertThat(loaded.getJobType()).isEqualTo("email_notification");
        assertThat(loaded.getCronExpression()).isEqualTo("* * * * *");
        assertThat(loaded.getParams()).containsEntry("to", "first@example.com");
        assertThat(loaded.isEnabled()).isTrue();
        assertThat(loaded.getNextFireAt()).isEqualTo(Instant.parse("2024-01-01T00:01:00Z"));
        assertThat(loaded.getLastStatus()).isEqualTo(ScheduledJob.LastStatus.NEVER_RUN);
        assertThat(loaded.getRunCount()).isZero();
        assertThat(loaded.getLockOwner()).isNull();
        assertThat(loaded.getCreatedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:30Z"));

        ScheduledJob disabled = store.get(second.getId());
        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.getNextFireAt()).isNull();

        assertThat(store.get(9999)).isNull();
    }

    @Test
    @DisplayName("List returns all jobs ordered by id")
    void testList() throws Exception {
        for (int i = 0; i < 12; i++) {
            insertDue("job-" + i, Instant.parse("2024-01-01T00:01:00Z").plusSeconds(60L * (12 - i)));
        }

        List<ScheduledJob> jobs = store.list();

        assertThat(jobs).hasSize(12);
        assertThat(jobs).extracting(ScheduledJob::getName).startsWith("job-0", "job-1", "job-2");
        assertThat(jobs).extracting(ScheduledJob::getId).isSorted();
    }

    @Test
    @DisplayName("Due jobs are enabled, past their fire time and unleased, earliest first")
    void testDueJobs() throws Exception {
        // Given
        ScheduledJob late = insertDue("late", Instant.parse("2024-01-01T00:00:20Z"));
        ScheduledJob early = insertDue("early", Instant.parse("2024-01-01T00:00:10Z"));
        ScheduledJob exact = insertDue("exact", Instant.parse("2024-01-01T00:00:30Z"));
        insertDue("future", Instant.parse("2024-01-01T00:01:00Z"));
        store.insert(draft("disabled", "* * * * *", null));

        // When
        List<ScheduledJob> due = store.dueJobs(clock.instant());

        // Then
        assertThat(due).extracting(ScheduledJob::getId)
                .containsExactly(early.getId(), late.getId(), exact.getId());
        assertThat(store.dueJobs(clock.instant(), 2)).extracting(ScheduledJob::getId)
                .containsExactly(early.getId(), late.getId());
    }

    @Test
    @DisplayName("Acquire takes the lease once and sets owner and expiry")
    void testAcquire() throws Exception {
        // Given
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:00:00Z"));

        // When
        boolean first = store.tryAcquire(job.getId(), "node-a", LEASE);
        boolean second = store.tryAcquire(job.getId(), "node-b", LEASE);

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        ScheduledJob leased = store.get(job.getId());
        assertThat(leased.getLockOwner()).isEqualTo("node-a");
        assertThat(leased.getLockExpiry()).isEqualTo(Instant.parse("2024-01-01T00:02:30Z"));
        assertThat(leased.isLockedAt(clock.instant())).isTrue();
        assertThat(store.dueJobs(clock.instant())).isEmpty();
    }

    @Test
    @DisplayName("Acquire refuses jobs that are not due, disabled or missing")
    void testAcquireRequiresDueJob() throws Exception {
        ScheduledJob future = insertDue("future", Instant.parse("2024-01-01T00:01:00Z"));
        ScheduledJob disabled = store.insert(draft("disabled", "* * * * *", null));

        assertThat(store.tryAcquire(future.getId(), "node-a", LEASE)).isFalse();
        assertThat(store.tryAcquire(disabled.getId(), "node-a", LEASE)).isFalse();
        assertThat(store.tryAcquire(4242, "node-a", LEASE)).isFalse();
    }

    @Test
    @DisplayName("A lease is live up to and including its expiry, then free to take over")
    void testLeaseExpiry() throws Exception {
        // Given
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isTrue();

        // When the clock reaches the expiry exactly the lease still holds
        clock.set("2024-01-01T00:02:30Z");
        assertThat(store.dueJobs(clock.instant())).isEmpty();
        assertThat(store.tryAcquire(job.getId(), "node-b", LEASE)).isFalse();

        // Then one millisecond later it is abandoned
        clock.advance(Duration.ofMillis(1));
        assertThat(store.dueJobs(clock.instant())).extracting(ScheduledJob::getId).containsExactly(job.getId());
        assertThat(store.tryAcquire(job.getId(), "node-b", LEASE)).isTrue();
        assertThat(store.get(job.getId()).getLockOwner()).isEqualTo("node-b");
    }

    @Test
    @DisplayName("Release by the owner records the outcome and moves the job on")
    void testReleaseAndReschedule() throws Exception {
        // Given
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:01:00Z"));
        clock.set("2024-01-01T00:01:00Z");
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isTrue();

        // When
        Instant firedAt = clock.instant();
        boolean released = store.releaseAndReschedule(job.getId(), "node-a", success(firedAt),
                Instant.parse("2024-01-01T00:02:00Z"));

        // Then
        assertThat(released).isTrue();
        ScheduledJob after = store.get(job.getId());
        assertThat(after.getRunCount()).isEqualTo(1);
        assertThat(after.getLastStatus()).isEqualTo(ScheduledJob.LastStatus.SUCCESS);
        assertThat(after.getLastFiredAt()).isEqualTo(firedAt);
        assertThat(after.getLastError()).isNull();
        assertThat(after.getLastResult()).containsEntry("sent", true);
        assertThat(after.getNextFireAt()).isEqualTo(Instant.parse("2024-01-01T00:02:00Z"));
        assertThat(after.getLockOwner()).isNull();
        assertThat(after.getLockExpiry()).isNull();
        assertThat(store.dueJobs(clock.instant())).isEmpty();
        assertThat(store.dueJobs(Instant.parse("2024-01-01T00:02:00Z"))).hasSize(1);
    }

    @Test
    @DisplayName("Release by a stale owner changes nothing")
    void testStaleReleaseRejected() throws Exception {
        // Given node-a's lease expired and node-b took over
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isTrue();
        clock.advance(LEASE.plusSeconds(1));
        assertThat(store.tryAcquire(job.getId(), "node-b", LEASE)).isTrue();

        // When node-a finally reports back
        ExecutionOutcome late = ExecutionOutcome.failure(Instant.parse("2024-01-01T00:00:30Z"), clock.instant(), "slow", 1);
        boolean released = store.releaseAndReschedule(job.getId(), "node-a", late, Instant.parse("2024-01-01T00:05:00Z"));

        // Then
        assertThat(released).isFalse();
        ScheduledJob after = store.get(job.getId());
        assertThat(after.getLockOwner()).isEqualTo("node-b");
        assertThat(after.getRunCount()).isZero();
        assertThat(after.getLastStatus()).isEqualTo(ScheduledJob.LastStatus.NEVER_RUN);
        assertThat(after.getNextFireAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Releasing a job disabled mid-run records the outcome and keeps it unscheduled")
    void testReleaseOfDisabledJob() throws Exception {
        // Given
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isTrue();
        JobRecord paused = JobRecord.copyOf(store.get(job.getId()));
        paused.disable();
        assertThat(store.update(paused)).isTrue();

        // When
        boolean released = store.releaseAndReschedule(job.getId(), "node-a", success(clock.instant()),
                Instant.parse("2024-01-01T00:01:00Z"));

        // Then
        assertThat(released).isTrue();
        ScheduledJob after = store.get(job.getId());
        assertThat(after.isEnabled()).isFalse();
        assertThat(after.getNextFireAt()).isNull();
        assertThat(after.getRunCount()).isEqualTo(1);
        assertThat(store.dueJobs(Instant.parse("2030-01-01T00:00:00Z"))).isEmpty();
    }

    @Test
    @DisplayName("Update is a compare-and-swap on the version and leaves the lease alone")
    void testUpdateCompareAndSwap() throws Exception {
        // Given
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:00:00Z"));
        JobRecord staleDraft = JobRecord.copyOf(store.get(job.getId()));
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isTrue();

        // When
        staleDraft.rename("renamed");
        boolean staleWrite = store.update(staleDraft);

        JobRecord freshDraft = JobRecord.copyOf(store.get(job.getId()));
        freshDraft.rename("renamed");
        freshDraft.changeCronExpression("*/5 * * * *");
        boolean freshWrite = store.update(freshDraft);

        // Then
        assertThat(staleWrite).isFalse();
        assertThat(freshWrite).isTrue();
        ScheduledJob after = store.get(job.getId());
        assertThat(after.getName()).isEqualTo("renamed");
        assertThat(after.getCronExpression()).isEqualTo("*/5 * * * *");
        assertThat(after.getLockOwner()).isEqualTo("node-a");
        assertThat(after.getVersion()).isGreaterThan(freshDraft.getVersion());

        JobRecord vanished = JobRecord.copyOf(after);
        store.delete(job.getId());
        assertThat(store.update(vanished)).isFalse();
    }

    @Test
    @DisplayName("Disabling a job removes it from the due set")
    void testDisableRemovesDueness() throws Exception {
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:00:00Z"));
        JobRecord draft = JobRecord.copyOf(job);
        draft.disable();

        assertThat(store.update(draft)).isTrue();
        assertThat(store.dueJobs(clock.instant())).isEmpty();
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isFalse();
    }

    @Test
    @DisplayName("Delete removes the job and any lease it holds")
    void testDelete() throws Exception {
        // Given
        ScheduledJob job = insertDue("job", Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(store.tryAcquire(job.getId(), "node-a", LEASE)).isTrue();

        // When
        boolean deleted = store.delete(job.getId());

        // Then
        assertThat(deleted).isTrue();
        assertThat(store.delete(job.getId())).isFalse();
        assertThat(store.get(job.getId())).isNull();
        assertThat(store.dueJobs(Instant.parse("2030-01-01T00:00:00Z"))).isEmpty();
        assertThat(store.releaseAndReschedule(job.getId(), "node-a", success(clock.instant()), null)).isFalse();
    }

    @Test
    @DisplayName("Two instances racing for the same due job: exactly one wins, the loser cannot release")
    void testTwoInstancesRaceForOneJob() throws Exception {
        // Given both instances saw the job as due
        ScheduledJob job = insertDue("job-42", Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(store.dueJobs(clock.instant())).hasSize(1);

        // When
        boolean a = store.tryAcquire(job.getId(), "node-a", LEASE);
        boolean b = store.tryAcquire(job.getId(), "node-b", LEASE);

        // Then
        assertThat(a).isTrue();
        assertThat(b).isFalse();
        assertThat(store.releaseAndReschedule(job.getId(), "node-b", success(clock.instant()),
                Instant.parse("2024-01-01T00:01:00Z"))).isFalse();
        assertThat(store.get(job.getId()).getRunCount()).isZero();
    }

    @Test
    @DisplayName("Concurrent acquires from many threads grant exactly one lease")
    void testConcurrentAcquire() throws Exception {
        // Given
        ScheduledJob job = insertDue("contended", Instant.parse("2024-01-01T00:00:00Z"));
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String instanceId = "node-" + i;
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return store.tryAcquire(job.getId(), instanceId, LEASE);
                };
                results.add(pool.submit(attempt));
            }

            // When
            start.countDown();

            // Then
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(store.get(job.getId()).getLockOwner()).startsWith("node-");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Metrics count jobs by state")
    void testMetrics() throws Exception {
        // Given
        ScheduledJob ok = insertDue("ok", Instant.parse("2024-01-01T00:00:00Z"));
        ScheduledJob failing = insertDue("failing", Instant.parse("2024-01-01T00:00:00Z"));
        insertDue("leased", Instant.parse("2024-01-01T00:00:00Z"));
        store.insert(draft("disabled", "* * * * *", null));

        store.tryAcquire(ok.getId(), "node-a", LEASE);
        store.releaseAndReschedule(ok.getId(), "node-a", success(clock.instant()), Instant.parse("2024-01-01T00:01:00Z"));
        store.tryAcquire(failing.getId(), "node-a", LEASE);
        store.releaseAndReschedule(failing.getId(), "node-a",
                ExecutionOutcome.failure(clock.instant(), clock.instant(), "boom", 1), Instant.parse("2024-01-01T00:01:00Z"));
        List<ScheduledJob> due = store.dueJobs(clock.instant());
        assertThat(due).hasSize(1);
        store.tryAcquire(due.get(0).getId(), "node-b", LEASE);

        // When
        StoreMetrics metrics = store.getMetrics();

        // Then
        assertThat(metrics.getTotalJobs()).isEqualTo(4);
        assertThat(metrics.getEnabledJobs()).isEqualTo(3);
        assertThat(metrics.getDisabledJobs()).isEqualTo(1);
        assertThat(metrics.getLockedJobs()).isEqualTo(1);
        assertThat(metrics.getFailingJobs()).isEqualTo(1);
        assertThat(metrics.getNeverRunJobs()).isEqualTo(2);
    }
}
