package com.umitunal.qcron.storage;

import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.core.ExecutionOutcome;
import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.core.StoreMetrics;
import com.umitunal.qcron.model.JobRecord;
import com.umitunal.qcron.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of JobStore.
 *
 * Rows live in the default column family keyed by id. The {@code due-index} column family holds
 * one empty-valued key {@code [nextFireAt][id]} per schedulable job, so a due scan walks keys in
 * fire-time order and stops at the first one in the future. Every mutation changes the row and
 * its index entry inside one optimistic transaction; a commit conflict means another writer got
 * to the row first.
 */
public class RocksJobStore implements JobStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksJobStore.class);

    static final byte[] DUE_INDEX_CF = "due-index".getBytes(UTF_8);
    static final byte[] META_CF = "meta".getBytes(UTF_8);
    private static final byte[] SEQUENCE_KEY = "job-sequence".getBytes(UTF_8);
    private static final byte[] EMPTY = new byte[0];
    private static final int MAX_CONFLICT_RETRIES = 5;

    private final OptimisticTransactionDB transactionDB;
    private final List<ColumnFamilyHandle> handles = new ArrayList<>();
    private final ColumnFamilyHandle jobsCf;
    private final ColumnFamilyHandle dueIndexCf;
    private final ColumnFamilyHandle metaCf;
    private final PayloadCodec<Map<String, Object>> codec;
    private final Clock clock;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong txnConflictCount = new AtomicLong(0);

    public RocksJobStore(StorageConfig config, PayloadCodec<Map<String, Object>> codec, Clock clock)
            throws RocksDBException {
        this.codec = codec;
        this.clock = clock;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads());

        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions),
                new ColumnFamilyDescriptor(DUE_INDEX_CF, cfOptions),
                new ColumnFamilyDescriptor(META_CF, cfOptions));

        this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory(), descriptors, handles);
        this.jobsCf = handles.get(0);
        this.dueIndexCf = handles.get(1);
        this.metaCf = handles.get(2);

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        // Snapshot at begin: a key written by someone else after we read it fails our commit
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.readOpts = new ReadOptions();

        // ReadOptions for scans - don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        logger.info("RocksJobStore opened at {}", config.getDataDirectory());
    }

    @Override
    public ScheduledJob insert(ScheduledJob job) throws RocksDBException {
        JobRecord inserted = retryOnConflict("insert", txn -> {
            byte[] current = txn.getForUpdate(readOpts, metaCf, SEQUENCE_KEY, true);
            long id = (current == null ? 0L : ByteBuffer.wrap(current).getLong()) + 1;
            txn.put(metaCf, SEQUENCE_KEY, ByteBuffer.allocate(8).putLong(id).array());

            JobRecord row = JobRecord.newRow(id, job);
            txn.put(jobsCf, JobRecord.createStorageKey(id), row.serialize(codec));
            index(txn, row);
            txn.commit();
            return row;
        });
        if (inserted == null) {
            throw new IllegalStateException("Could not allocate a job id after " + MAX_CONFLICT_RETRIES + " attempts");
        }
        return inserted;
    }

    @Override
    public ScheduledJob get(long jobId) throws RocksDBException {
        byte[] value = transactionDB.get(jobsCf, JobRecord.createStorageKey(jobId));
        return value != null ? JobRecord.deserialize(value, codec) : null;
    }

    @Override
    public List<ScheduledJob> list() {
        List<ScheduledJob> jobs = new ArrayList<>();
        try (final RocksIterator iter = transactionDB.newIterator(jobsCf, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                jobs.add(JobRecord.deserialize(iter.value(), codec));
            }
        }
        return jobs;
    }

    @Override
    public boolean update(ScheduledJob job) throws RocksDBException {
        Boolean written = inSingleTransaction("update", txn -> {
            JobRecord row = readForUpdate(txn, job.getId());
            if (row == null || row.getVersion() != job.getVersion()) {
                return false;
            }
            unindex(txn, row);
            row.applyDefinition(job);
            txn.put(jobsCf, JobRecord.createStorageKey(row.getId()), row.serialize(codec));
            index(txn, row);
            txn.commit();
            return true;
        });
        return Boolean.TRUE.equals(written);
    }

    @Override
    public boolean delete(long jobId) throws RocksDBException {
        Boolean deleted = retryOnConflict("delete", txn -> {
            JobRecord row = readForUpdate(txn, jobId);
            if (row == null) {
                return false;
            }
            unindex(txn, row);
            txn.delete(jobsCf, JobRecord.createStorageKey(jobId));
            txn.commit();
            return true;
        });
        if (deleted == null) {
            throw new IllegalStateException("Could not delete job " + jobId + " after " + MAX_CONFLICT_RETRIES + " attempts");
        }
        return deleted;
    }

    @Override
    public List<ScheduledJob> dueJobs(Instant now, int limit) throws RocksDBException {
        List<ScheduledJob> due = new ArrayList<>();
        long nowMillis = now.toEpochMilli();

        try (final RocksIterator iter = transactionDB.newIterator(dueIndexCf, scanReadOpts)) {
            iter.seekToFirst();

            while (iter.isValid() && due.size() < limit) {
                byte[] indexKey = iter.key();

                // Early termination: the index is ordered by fire time
                if (JobRecord.dueIndexFireTime(indexKey) > nowMillis) {
                    break;
                }

                byte[] value = transactionDB.get(jobsCf, JobRecord.createStorageKey(JobRecord.dueIndexJobId(indexKey)));
                if (value != null) {
                    JobRecord row = JobRecord.deserialize(value, codec);
                    if (row.isDueAt(now) && row.isLeaseAvailable(now)) {
                        due.add(row);
                    }
                }

                iter.next();
            }
        }

        return due;
    }

    @Override
    public boolean tryAcquire(long jobId, String instanceId, Duration leaseDuration) throws RocksDBException {
        Instant now = Instant.ofEpochMilli(clock.millis());
        Boolean acquired = inSingleTransaction("acquire", txn -> {
            JobRecord row = readForUpdate(txn, jobId);

            // Verify the job is still due and nobody holds a live lease
            if (row == null || !row.isDueAt(now) || !row.isLeaseAvailable(now)) {
                return false;
            }

            row.lease(instanceId, now.plus(leaseDuration));
            txn.put(jobsCf, JobRecord.createStorageKey(jobId), row.serialize(codec));
            txn.commit();
            return true;
        });
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public boolean releaseAndReschedule(long jobId, String instanceId, ExecutionOutcome outcome, Instant nextFireAt)
            throws RocksDBException {
        Boolean released = retryOnConflict("release", txn -> {
            JobRecord row = readForUpdate(txn, jobId);
            if (row == null || !instanceId.equals(row.getLockOwner())) {
                return false;
            }
            unindex(txn, row);
            row.releaseAndReschedule(outcome, nextFireAt);
            txn.put(jobsCf, JobRecord.createStorageKey(jobId), row.serialize(codec));
            index(txn, row);
            txn.commit();
            return true;
        });
        return Boolean.TRUE.equals(released);
    }

    @Override
    public StoreMetrics getMetrics() {
        Instant now = Instant.ofEpochMilli(clock.millis());
        StoreMetricsCollector collector = StoreMetricsCollector.create();

        try (final RocksIterator iter = transactionDB.newIterator(jobsCf, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                collector.add(JobRecord.deserialize(iter.value(), codec), now);
            }
        }

        return collector.toMetrics();
    }

    /**
     * Get the number of commits that failed on a conflicting write.
     * Useful for monitoring contention between instances.
     */
    public long getTransactionConflictCount() {
        return txnConflictCount.get();
    }

    @Override
    public void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (readOpts != null) {
            readOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        if (cfOptions != null) {
            cfOptions.close();
        }
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }

    private JobRecord readForUpdate(Transaction txn, long jobId) throws RocksDBException {
        byte[] value = txn.getForUpdate(readOpts, jobsCf, JobRecord.createStorageKey(jobId), true);
        return value != null ? JobRecord.deserialize(value, codec) : null;
    }

    private void index(Transaction txn, JobRecord row) throws RocksDBException {
        if (row.isEnabled() && row.getNextFireAt() != null) {
            txn.put(dueIndexCf, JobRecord.createDueIndexKey(row.getNextFireAt(), row.getId()), EMPTY);
        }
    }

    private void unindex(Transaction txn, JobRecord row) throws RocksDBException {
        if (row.getNextFireAt() != null) {
            txn.delete(dueIndexCf, JobRecord.createDueIndexKey(row.getNextFireAt(), row.getId()));
        }
    }

    /**
     * Run {@code work} in one transaction. A commit conflict is a lost race: it is counted and
     * reported as a null result. Any other storage error propagates.
     */
    private <R> R inSingleTransaction(String operation, TransactionWork<R> work) throws RocksDBException {
        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            return work.run(txn);
        } catch (RocksDBException e) {
            if (!isConflict(e)) {
                throw e;
            }
            txnConflictCount.incrementAndGet();
            logger.debug("{} lost a write conflict: {}", operation, e.getMessage());
            return null;
        }
    }

    /**
     * Run {@code work} until it commits without conflict, at most {@link #MAX_CONFLICT_RETRIES} times.
     *
     * @return the work's result, or null if every attempt conflicted
     */
    private <R> R retryOnConflict(String operation, TransactionWork<R> work) throws RocksDBException {
        for (int attempt = 0; attempt < MAX_CONFLICT_RETRIES; attempt++) {
            R result = inSingleTransaction(operation, work);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    @FunctionalInterface
    private interface TransactionWork<R> {
        R run(Transaction txn) throws RocksDBException;
    }
}
