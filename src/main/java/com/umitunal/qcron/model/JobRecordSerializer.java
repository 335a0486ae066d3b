package com.umitunal.qcron.model;

import com.umitunal.qcron.core.ScheduledJob;
import com.umitunal.qcron.serialization.PayloadCodec;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary row format for JobRecord using ByteBuffer.
 *
 * Binary format:
 * - format version (1 byte)
 * - id (8 bytes)
 * - name, jobType, cronExpression: length (4 bytes) + UTF-8 bytes each
 * - params length (4 bytes) + codec bytes
 * - createdAt (8 bytes)
 * - enabled (1 byte)
 * - nextFireAt, lastFiredAt (8 bytes each, {@link #NO_TIME} when null)
 * - lastStatus ordinal (4 bytes)
 * - lastError: length (4 bytes, -1 when null) + UTF-8 bytes
 * - lastResult: length (4 bytes, -1 when null) + codec bytes
 * - runCount (8 bytes)
 * - lockOwner: length (4 bytes, -1 when null) + UTF-8 bytes
 * - lockExpiry (8 bytes, {@link #NO_TIME} when null)
 * - version (8 bytes)
 */
public class JobRecordSerializer {
    static final byte FORMAT_VERSION = 1;
    static final long NO_TIME = Long.MIN_VALUE;

    private final PayloadCodec<Map<String, Object>> payloadCodec;

    public JobRecordSerializer(PayloadCodec<Map<String, Object>> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(JobRecord record) {
        byte[] nameBytes = record.getName().getBytes(UTF_8);
        byte[] typeBytes = record.getJobType().getBytes(UTF_8);
        byte[] cronBytes = record.getCronExpression().getBytes(UTF_8);
        byte[] paramsBytes = payloadCodec.encode(new LinkedHashMap<>(record.getParams()));
        byte[] errorBytes = record.getLastError() != null ? record.getLastError().getBytes(UTF_8) : null;
        byte[] resultBytes = record.getLastResult() != null
                ? payloadCodec.encode(new LinkedHashMap<>(record.getLastResult()))
                : null;
        byte[] ownerBytes = record.getLockOwner() != null ? record.getLockOwner().getBytes(UTF_8) : null;

        int totalSize = 1 + 8 +                         // format, id
                4 + nameBytes.length +
                4 + typeBytes.length +
                4 + cronBytes.length +
                4 + paramsBytes.length +
                8 +                                     // createdAt
                1 +                                     // enabled
                8 + 8 +                                 // nextFireAt, lastFiredAt
                4 +                                     // lastStatus
                4 + lengthOf(errorBytes) +
                4 + lengthOf(resultBytes) +
                8 +                                     // runCount
                4 + lengthOf(ownerBytes) +
                8 +                                     // lockExpiry
                8;                                      // version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);
        buffer.putLong(record.getId());

        putBytes(buffer, nameBytes);
        putBytes(buffer, typeBytes);
        putBytes(buffer, cronBytes);
        putBytes(buffer, paramsBytes);

        buffer.putLong(record.getCreatedAt().toEpochMilli());
        buffer.put((byte) (record.isEnabled() ? 1 : 0));
        putTime(buffer, record.getNextFireAt());
        putTime(buffer, record.getLastFiredAt());
        buffer.putInt(record.getLastStatus().ordinal());

        putBytes(buffer, errorBytes);
        putBytes(buffer, resultBytes);

        buffer.putLong(record.getRunCount());
        putBytes(buffer, ownerBytes);
        putTime(buffer, record.getLockExpiry());
        buffer.putLong(record.getVersion());

        return buffer.array();
    }

    public JobRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported job row format: " + format);
        }
        long id = buffer.getLong();
        String name = new String(getBytes(buffer), UTF_8);
        String jobType = new String(getBytes(buffer), UTF_8);
        String cron = new String(getBytes(buffer), UTF_8);
        Map<String, Object> params = payloadCodec.decode(getBytes(buffer));
        Instant createdAt = Instant.ofEpochMilli(buffer.getLong());

        JobRecord record = new JobRecord(id, name, jobType, cron, params, createdAt);

        // Restore schedule state
        record.setEnabled(buffer.get() == 1);
        record.setNextFireAt(getTime(buffer));
        record.setLastFiredAt(getTime(buffer));
        record.setLastStatus(ScheduledJob.LastStatus.values()[buffer.getInt()]);

        byte[] errorBytes = getBytes(buffer);
        if (errorBytes != null) {
            record.setLastError(new String(errorBytes, UTF_8));
        }
        byte[] resultBytes = getBytes(buffer);
        if (resultBytes != null) {
            record.setLastResult(payloadCodec.decode(resultBytes));
        }

        record.setRunCount(buffer.getLong());
        byte[] ownerBytes = getBytes(buffer);
        if (ownerBytes != null) {
            record.setLockOwner(new String(ownerBytes, UTF_8));
        }
        record.setLockExpiry(getTime(buffer));
        record.setVersion(buffer.getLong());

        return record;
    }

    private static int lengthOf(byte[] bytes) {
        return bytes != null ? bytes.length : 0;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        if (bytes == null) {
            buffer.putInt(-1);
            return;
        }
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    private static void putTime(ByteBuffer buffer, Instant time) {
        buffer.putLong(time != null ? time.toEpochMilli() : NO_TIME);
    }

    private static Instant getTime(ByteBuffer buffer) {
        long millis = buffer.getLong();
        return millis == NO_TIME ? null : Instant.ofEpochMilli(millis);
    }
}
