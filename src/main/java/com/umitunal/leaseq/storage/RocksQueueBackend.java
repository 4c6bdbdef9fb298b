package com.umitunal.leaseq.storage;

import com.umitunal.leaseq.config.BackendConfig;
import com.umitunal.leaseq.config.StorageConfig;
import com.umitunal.leaseq.core.JobEvent;
import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.JobStatus;
import com.umitunal.leaseq.core.LeaseToken;
import com.umitunal.leaseq.core.LeasedJob;
import com.umitunal.leaseq.core.QueueBackend;
import com.umitunal.leaseq.core.QueueCapabilities;
import com.umitunal.leaseq.core.QueueCapabilities.Capability;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.core.QueueException;
import com.umitunal.leaseq.core.QueueMetrics;
import com.umitunal.leaseq.events.JobEventBus;
import com.umitunal.leaseq.events.JobEventSubscription;
import com.umitunal.leaseq.model.JobRecord;
import com.umitunal.leaseq.model.JobRecordSerializer;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of QueueBackend.
 *
 * <p>Key layout:
 * <ul>
 *   <li>{@code r/<tenant>/<jobId>} serialized {@link JobRecord}</li>
 *   <li>{@code i/<scope>} job id owning an idempotency key, where the tenant, queue, job type and
 *   key are each length-prefixed</li>
 * </ul>
 * All mutations run under one lock and are written as a single {@link WriteBatch}, so a transition
 * and its idempotency entry land together. Events are published only after the batch is written
 * and are not persisted. Dead-letter inspection is not supported.
 */
public class RocksQueueBackend implements QueueBackend, LeaseRecovery {
    private static final Logger log = LoggerFactory.getLogger(RocksQueueBackend.class);

    private static final String RECORD_PREFIX = "r/";
    private static final String IDEMPOTENCY_PREFIX = "i/";

    private final RocksDB db;
    private final JobRecordSerializer serializer = new JobRecordSerializer();
    private final BackendConfig config;
    private final Clock clock;
    private final QueueCapabilities capabilities;
    private final JobEventBus eventBus;
    private final WriteOptions writeOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final ReentrantLock writeLock = new ReentrantLock();
    private long sequence;

    public RocksQueueBackend(StorageConfig storage) throws QueueException {
        this(storage, BackendConfig.defaults());
    }

    public RocksQueueBackend(StorageConfig storage, BackendConfig config) throws QueueException {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = config.getClock();
        this.capabilities = QueueCapabilities.all().without(Capability.DEAD_LETTER_QUEUE);
        this.eventBus = new JobEventBus(config.getEventBufferSize());

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache((long) storage.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) storage.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(storage.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(storage.getBackgroundThreads())
                .setTableFormatConfig(tableConfig)
                .setMaxOpenFiles(-1);

        this.writeOpts = new WriteOptions()
                .setSync(storage.isDurableWrites());

        // Scans don't pollute the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        try {
            this.db = RocksDB.open(dbOptions, storage.getDataDirectory());
        } catch (RocksDBException e) {
            closeOptions();
            throw QueueException.internal("Failed to open RocksDB at " + storage.getDataDirectory(), e);
        }

        this.sequence = restoreSequence();
        log.info("RocksDB backend opened dir={} durableWrites={} sequence={}",
                storage.getDataDirectory(), storage.isDurableWrites(), sequence);
    }

    @Override
    public JobId enqueue(QueueCtx ctx, JobMessage message) throws QueueException {
        Objects.requireNonNull(message, "message must not be null");
        LeaseRules.checkPayload(message, config.getMaxPayloadBytes());

        writeLock.lock();
        try {
            Instant now = clock.instant();
            byte[] idempotencyKey = null;
            if (message.getIdempotencyKey() != null) {
                idempotencyKey = idempotencyKey(ctx.getTenantId(), message);
                byte[] existingId = db.get(idempotencyKey);
                if (existingId != null) {
                    JobId jobId = JobId.of(new String(existingId, UTF_8));
                    JobRecord existing = load(ctx.getTenantId(), jobId);
                    if (existing != null && !existing.isTerminal()) {
                        log.debug("Deduplicated enqueue tenant={} key={} jobId={}",
                                ctx.getTenantId(), message.getIdempotencyKey(), jobId);
                        return jobId;
                    }
                }
            }

            JobRecord record = new JobRecord(JobId.random(), ctx.getTenantId(), message, now, sequence + 1);
            try (WriteBatch batch = new WriteBatch()) {
                batch.put(recordKey(ctx.getTenantId(), record.getJobId()), serializer.serialize(record));
                if (idempotencyKey != null) {
                    batch.put(idempotencyKey, record.getJobId().value().getBytes(UTF_8));
                }
                db.write(writeOpts, batch);
            }
            sequence++;

            log.debug("Enqueued tenant={} queue={} type={} jobId={}",
                    ctx.getTenantId(), message.getQueue(), message.getJobType(), record.getJobId());
            eventBus.publish(LeaseRules.enqueued(record));
            return record.getJobId();
        } catch (RocksDBException e) {
            throw QueueException.internal("Failed to enqueue job", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<LeasedJob> dequeue(QueueCtx ctx, Collection<String> queues) throws QueueException {
        Objects.requireNonNull(queues, "queues must not be null");
        if (queues.isEmpty()) {
            return Optional.empty();
        }
        Set<String> queueSet = new HashSet<>(queues);

        writeLock.lock();
        try (WriteBatch batch = new WriteBatch()) {
            Instant now = clock.instant();
            List<JobEvent> events = new ArrayList<>();
            JobRecord best = null;

            for (JobRecord record : scanTenant(ctx.getTenantId())) {
                if (!queueSet.contains(record.getQueue())) {
                    continue;
                }
                if (record.isLeaseExpired(now)) {
                    events.add(reclaim(record, now));
                    batch.put(recordKey(record), serializer.serialize(record));
                }
                if (record.isEligible(now) && (best == null || LeaseRules.DEQUEUE_ORDER.compare(record, best) < 0)) {
                    best = record;
                }
            }

            LeasedJob leased = null;
            if (best != null) {
                LeaseToken token = LeaseToken.random();
                best.lease(token, now, config.getLeaseDuration());
                batch.put(recordKey(best), serializer.serialize(best));
                events.add(LeaseRules.leased(best, now));
                leased = new LeasedJob(best.getJobId(), token, best.getMessage(),
                        best.getLeaseUntil(), best.getAttemptCount(), best.getTenantId());
            }

            if (batch.count() > 0) {
                db.write(writeOpts, batch);
            }
            events.forEach(eventBus::publish);
            if (leased != null) {
                log.debug("Leased tenant={} jobId={} attempt={}", ctx.getTenantId(), leased.getJobId(), leased.getAttemptCount());
            }
            return Optional.ofNullable(leased);
        } catch (RocksDBException e) {
            throw QueueException.internal("Failed to dequeue", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void ackComplete(QueueCtx ctx, JobId jobId, LeaseToken token, String resultRef) throws QueueException {
        writeLock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = load(ctx.getTenantId(), jobId);
            LeaseRules.checkLease(record, jobId, token, now);
            record.markCompleted(resultRef, now);
            save(record);
            log.debug("Completed tenant={} jobId={}", ctx.getTenantId(), jobId);
            eventBus.publish(LeaseRules.completed(record, now));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void ackFail(QueueCtx ctx, JobId jobId, LeaseToken token, String error, Instant retryAt) throws QueueException {
        writeLock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = load(ctx.getTenantId(), jobId);
            LeaseRules.checkLease(record, jobId, token, now);
            JobEvent event = LeaseRules.fail(record, error, retryAt, now);
            save(record);
            log.debug("Attempt failed tenant={} jobId={} status={} error={}", ctx.getTenantId(), jobId, record.getStatus(), error);
            eventBus.publish(event);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void heartbeatExtend(QueueCtx ctx, JobId jobId, LeaseToken token, Duration extra) throws QueueException {
        Objects.requireNonNull(extra, "extra must not be null");
        if (extra.isNegative()) {
            throw new IllegalArgumentException("extra must not be negative");
        }
        writeLock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = load(ctx.getTenantId(), jobId);
            LeaseRules.checkLease(record, jobId, token, now);
            record.extendLease(extra, now);
            save(record);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean cancel(QueueCtx ctx, JobId jobId) throws QueueException {
        writeLock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = load(ctx.getTenantId(), jobId);
            if (record == null) {
                throw QueueException.jobNotFound(jobId);
            }
            if (record.isTerminal()) {
                return false;
            }
            record.markCanceled(now);
            save(record);
            log.debug("Canceled tenant={} jobId={}", ctx.getTenantId(), jobId);
            eventBus.publish(LeaseRules.canceled(record, now));
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public JobStatus getStatus(QueueCtx ctx, JobId jobId) throws QueueException {
        return getRecord(ctx, jobId).getStatus();
    }

    @Override
    public JobRecord getRecord(QueueCtx ctx, JobId jobId) throws QueueException {
        JobRecord record = load(ctx.getTenantId(), jobId);
        if (record == null) {
            throw QueueException.jobNotFound(jobId);
        }
        return record;
    }

    @Override
    public JobEventSubscription eventStream(QueueCtx ctx) {
        return eventBus.subscribe(ctx.getTenantId());
    }

    public JobEventBus getEventBus() {
        return eventBus;
    }

    @Override
    public QueueCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public QueueMetrics metrics(QueueCtx ctx, Collection<String> queues) throws QueueException {
        Set<String> queueSet = new HashSet<>(queues);
        long total = 0;
        long pending = 0;
        long leased = 0;
        long retrying = 0;
        long completed = 0;
        long failed = 0;
        long canceled = 0;
        long eligible = 0;

        Instant now = clock.instant();
        for (JobRecord record : scanTenant(ctx.getTenantId())) {
            total++;
            switch (record.getStatus()) {
                case PENDING -> pending++;
                case LEASED -> leased++;
                case RETRYING -> retrying++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case CANCELED -> canceled++;
            }
            if (queueSet.contains(record.getQueue()) && record.isEligible(now)) {
                eligible++;
            }
        }
        return new QueueMetrics(ctx.getTenantId(), total, pending, leased, retrying, completed, failed, canceled, eligible);
    }

    @Override
    public List<JobRecord> deadLetters(QueueCtx ctx) throws QueueException {
        throw QueueException.unsupported("dead-letter inspection");
    }

    @Override
    public JobId replayDeadLetter(QueueCtx ctx, JobId jobId) throws QueueException {
        throw QueueException.unsupported("dead-letter replay");
    }

    @Override
    public int recoverExpiredLeases() throws QueueException {
        writeLock.lock();
        try (WriteBatch batch = new WriteBatch()) {
            Instant now = clock.instant();
            List<JobEvent> events = new ArrayList<>();
            for (JobRecord record : scan(RECORD_PREFIX.getBytes(UTF_8), null)) {
                if (record.isLeaseExpired(now)) {
                    events.add(reclaim(record, now));
                    batch.put(recordKey(record), serializer.serialize(record));
                }
            }
            if (batch.count() > 0) {
                db.write(writeOpts, batch);
            }
            events.forEach(eventBus::publish);
            return events.size();
        } catch (RocksDBException e) {
            throw QueueException.internal("Failed to recover expired leases", e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Delete terminal records of a tenant, with the idempotency entries pointing at them.
     *
     * @return number of records removed
     */
    public long purgeTerminal(QueueCtx ctx) throws QueueException {
        writeLock.lock();
        try (WriteBatch batch = new WriteBatch()) {
            long purged = 0;
            for (JobRecord record : scanTenant(ctx.getTenantId())) {
                if (record.isTerminal()) {
                    batch.delete(recordKey(record));
                    if (record.getMessage().getIdempotencyKey() != null) {
                        byte[] key = idempotencyKey(record.getTenantId(), record.getMessage());
                        byte[] owner = db.get(key);
                        if (owner != null && record.getJobId().value().equals(new String(owner, UTF_8))) {
                            batch.delete(key);
                        }
                    }
                    purged++;
                }
            }
            if (batch.count() > 0) {
                db.write(writeOpts, batch);
            }
            log.info("Purged terminal jobs tenant={} count={}", ctx.getTenantId(), purged);
            return purged;
        } catch (RocksDBException e) {
            throw QueueException.internal("Failed to purge terminal jobs", e);
        } finally {
            writeLock.unlock();
        }
    }

    private JobEvent reclaim(JobRecord record, Instant now) {
        JobEvent event = LeaseRules.reclaim(record, now);
        log.warn("Reclaimed expired lease tenant={} jobId={} attempt={} status={}",
                record.getTenantId(), record.getJobId(), record.getAttemptCount(), record.getStatus());
        return event;
    }

    /**
     * Record of {@code jobId} owned by {@code tenantId}, or null. Tenant and job ids may contain
     * {@code /}, so a key match alone does not prove ownership.
     */
    private JobRecord load(String tenantId, JobId jobId) throws QueueException {
        try {
            byte[] value = db.get(recordKey(tenantId, jobId));
            if (value == null) {
                return null;
            }
            JobRecord record = serializer.deserialize(value);
            if (!tenantId.equals(record.getTenantId())) {
                log.warn("Rejected cross-tenant lookup tenant={} jobId={}", tenantId, jobId);
                return null;
            }
            return record;
        } catch (RocksDBException e) {
            throw QueueException.internal("Failed to read job " + jobId, e);
        }
    }

    private void save(JobRecord record) throws QueueException {
        try {
            db.put(writeOpts, recordKey(record), serializer.serialize(record));
        } catch (RocksDBException e) {
            throw QueueException.internal("Failed to write job " + record.getJobId(), e);
        }
    }

    private List<JobRecord> scanTenant(String tenantId) {
        return scan((RECORD_PREFIX + tenantId + "/").getBytes(UTF_8), tenantId);
    }

    /**
     * Records under {@code prefix}; when {@code tenantId} is given, records of tenants whose id
     * merely starts with it are skipped.
     */
    private List<JobRecord> scan(byte[] prefix, String tenantId) {
        List<JobRecord> records = new ArrayList<>();
        try (RocksIterator iter = db.newIterator(scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && startsWith(iter.key(), prefix); iter.next()) {
                JobRecord record = serializer.deserialize(iter.value());
                if (tenantId == null || tenantId.equals(record.getTenantId())) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    private long restoreSequence() {
        long max = 0;
        for (JobRecord record : scan(RECORD_PREFIX.getBytes(UTF_8), null)) {
            max = Math.max(max, record.getSequence());
        }
        return max;
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] recordKey(JobRecord record) {
        return recordKey(record.getTenantId(), record.getJobId());
    }

    private static byte[] recordKey(String tenantId, JobId jobId) {
        return (RECORD_PREFIX + tenantId + "/" + jobId.value()).getBytes(UTF_8);
    }

    private static byte[] idempotencyKey(String tenantId, JobMessage message) {
        return (IDEMPOTENCY_PREFIX + IdempotencyScope.of(tenantId, message).toKey()).getBytes(UTF_8);
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            db.close();
            closeOptions();
            log.info("RocksDB backend closed");
        } finally {
            writeLock.unlock();
        }
    }

    private void closeOptions() {
        scanReadOpts.close();
        writeOpts.close();
        dbOptions.close();
        // BlockBasedTableConfig has no close(); it goes with the Options
        blockCache.close();
        bloomFilter.close();
    }
}
