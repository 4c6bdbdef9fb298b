package com.umitunal.leaseq.model;

import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.JobPriority;
import com.umitunal.leaseq.core.JobStatus;
import com.umitunal.leaseq.core.LeaseToken;

import java.nio.ByteBuffer;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * ByteBuffer serializer for {@link JobRecord}.
 *
 * Binary format (strings are a 4 byte length, -1 for null, then UTF-8 bytes;
 * instants are epoch seconds (8 bytes) + nanos (4 bytes), with seconds = Long.MIN_VALUE for null):
 * - format version (1 byte)
 * - jobId, tenantId
 * - jobType, codec, queue
 * - payload length (4 bytes) + payload bytes
 * - priority value (4 bytes)
 * - maxRetries (4 bytes)
 * - runAt
 * - idempotencyKey
 * - createdAt, sequence (8 bytes)
 * - status ordinal (4 bytes)
 * - attemptCount (4 bytes)
 * - lastError, leaseToken
 * - leaseUntil, eligibleAt, updatedAt
 * - resultRef
 * - version (8 bytes)
 */
public class JobRecordSerializer {

    private static final byte FORMAT_VERSION = 1;
    private static final long NULL_INSTANT = Long.MIN_VALUE;

    public byte[] serialize(JobRecord record) {
        JobMessage message = record.getMessage();
        byte[][] strings = {
                bytes(record.getJobId().value()),
                bytes(record.getTenantId()),
                bytes(message.getJobType()),
                bytes(message.getCodec()),
                bytes(message.getQueue()),
                bytes(message.getIdempotencyKey()),
                bytes(record.getLastError()),
                bytes(record.getLeaseToken() != null ? record.getLeaseToken().value() : null),
                bytes(record.getResultRef())
        };
        byte[] payload = message.getPayload();

        int totalSize = 1                      // format version
                + 4 + payload.length           // payload
                + 4                            // priority
                + 4                            // maxRetries
                + 12 * 5                       // runAt, createdAt, leaseUntil, eligibleAt, updatedAt
                + 8                            // sequence
                + 4                            // status
                + 4                            // attemptCount
                + 8;                           // version
        for (byte[] s : strings) {
            totalSize += 4 + (s != null ? s.length : 0);
        }

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);

        putBytes(buffer, strings[0]);
        putBytes(buffer, strings[1]);

        // Message
        putBytes(buffer, strings[2]);
        putBytes(buffer, strings[3]);
        putBytes(buffer, strings[4]);
        buffer.putInt(payload.length);
        buffer.put(payload);
        buffer.putInt(message.getPriority().value());
        buffer.putInt(message.getMaxRetries());
        putInstant(buffer, message.getRunAt());
        putBytes(buffer, strings[5]);

        // Lifecycle
        putInstant(buffer, record.getCreatedAt());
        buffer.putLong(record.getSequence());
        buffer.putInt(record.getStatus().ordinal());
        buffer.putInt(record.getAttemptCount());
        putBytes(buffer, strings[6]);
        putBytes(buffer, strings[7]);
        putInstant(buffer, record.getLeaseUntil());
        putInstant(buffer, record.getEligibleAt());
        putInstant(buffer, record.getUpdatedAt());
        putBytes(buffer, strings[8]);
        buffer.putLong(record.getVersion());

        return buffer.array();
    }

    public JobRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported record format: " + format);
        }

        JobId jobId = JobId.of(getString(buffer));
        String tenantId = getString(buffer);

        String jobType = getString(buffer);
        String codec = getString(buffer);
        String queue = getString(buffer);
        byte[] payload = new byte[buffer.getInt()];
        buffer.get(payload);
        JobPriority priority = JobPriority.fromValue(buffer.getInt());
        int maxRetries = buffer.getInt();
        Instant runAt = getInstant(buffer);
        String idempotencyKey = getString(buffer);

        JobMessage message = JobMessage.builder(jobType, codec, payload)
                .queue(queue)
                .priority(priority)
                .maxRetries(maxRetries)
                .runAt(runAt)
                .idempotencyKey(idempotencyKey)
                .build();

        Instant createdAt = getInstant(buffer);
        long sequence = buffer.getLong();
        JobRecord record = new JobRecord(jobId, tenantId, message, createdAt, sequence);

        // Restore internal state
        record.setStatus(JobStatus.values()[buffer.getInt()]);
        record.setAttemptCount(buffer.getInt());
        record.setLastError(getString(buffer));
        String token = getString(buffer);
        record.setLeaseToken(token != null ? LeaseToken.of(token) : null);
        record.setLeaseUntil(getInstant(buffer));
        record.setEligibleAt(getInstant(buffer));
        record.setUpdatedAt(getInstant(buffer));
        record.setResultRef(getString(buffer));
        record.setVersion(buffer.getLong());

        return record;
    }

    private static byte[] bytes(String value) {
        return value != null ? value.getBytes(UTF_8) : null;
    }

    private static void putBytes(ByteBuffer buffer, byte[] value) {
        if (value == null) {
            buffer.putInt(-1);
            return;
        }
        buffer.putInt(value.length);
        buffer.put(value);
    }

    private static String getString(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] value = new byte[length];
        buffer.get(value);
        return new String(value, UTF_8);
    }

    private static void putInstant(ByteBuffer buffer, Instant instant) {
        if (instant == null) {
            buffer.putLong(NULL_INSTANT);
            buffer.putInt(0);
            return;
        }
        buffer.putLong(instant.getEpochSecond());
        buffer.putInt(instant.getNano());
    }

    private static Instant getInstant(ByteBuffer buffer) {
        long seconds = buffer.getLong();
        int nanos = buffer.getInt();
        return seconds == NULL_INSTANT ? null : Instant.ofEpochSecond(seconds, nanos);
    }
}
