package com.umitunal.leaseq.storage;

import com.umitunal.leaseq.config.BackendConfig;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference backend keeping every job in memory.
 *
 * <p>Jobs are partitioned by tenant. Each partition has a single writer lock, so a dequeue's scan,
 * selection and lease issuance happen in one critical section and cancel/ack races are decided
 * there too. Expired leases are reclaimed lazily by dequeue, or eagerly through
 * {@link #recoverExpiredLeases()}.
 */
public class InMemoryQueueBackend implements QueueBackend, LeaseRecovery {
    private static final Logger log = LoggerFactory.getLogger(InMemoryQueueBackend.class);

    private final BackendConfig config;
    private final Clock clock;
    private final QueueCapabilities capabilities;
    private final JobEventBus eventBus;
    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    private static final class Partition {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<JobId, JobRecord> jobs = new HashMap<>();
        private final Map<IdempotencyScope, JobId> idempotencyKeys = new HashMap<>();
        private final Map<JobId, JobRecord> deadLetters = new LinkedHashMap<>();
    }

    public InMemoryQueueBackend() {
        this(BackendConfig.defaults());
    }

    public InMemoryQueueBackend(BackendConfig config) {
        this(config, config.isDeadLetterQueue()
                ? QueueCapabilities.all()
                : QueueCapabilities.all().without(Capability.DEAD_LETTER_QUEUE));
    }

    /**
     * Backend restricted to the given capabilities.
     */
    public InMemoryQueueBackend(BackendConfig config, QueueCapabilities capabilities) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
        this.clock = config.getClock();
        this.eventBus = new JobEventBus(config.getEventBufferSize());
    }

    private Partition partition(QueueCtx ctx) {
        Objects.requireNonNull(ctx, "ctx must not be null");
        return partitions.computeIfAbsent(ctx.getTenantId(), t -> new Partition());
    }

    @Override
    public JobId enqueue(QueueCtx ctx, JobMessage message) throws QueueException {
        Objects.requireNonNull(message, "message must not be null");
        LeaseRules.checkPayload(message, config.getMaxPayloadBytes());
        if (message.getIdempotencyKey() != null) {
            LeaseRules.requireCapability(capabilities, Capability.IDEMPOTENCY, "idempotency keys");
        }

        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            return insert(partition, ctx, message, clock.instant());
        } finally {
            partition.lock.unlock();
        }
    }

    private JobId insert(Partition partition, QueueCtx ctx, JobMessage message, Instant now) {
        IdempotencyScope scope = null;
        if (message.getIdempotencyKey() != null) {
            scope = IdempotencyScope.of(ctx.getTenantId(), message);
            JobId existingId = partition.idempotencyKeys.get(scope);
            JobRecord existing = existingId != null ? partition.jobs.get(existingId) : null;
            if (existing != null && !existing.isTerminal()) {
                log.debug("Deduplicated enqueue tenant={} key={} jobId={}",
                        ctx.getTenantId(), message.getIdempotencyKey(), existingId);
                return existingId;
            }
        }

        JobRecord record = new JobRecord(JobId.random(), ctx.getTenantId(), message, now, sequence.incrementAndGet());
        partition.jobs.put(record.getJobId(), record);
        if (scope != null) {
            partition.idempotencyKeys.put(scope, record.getJobId());
        }
        log.debug("Enqueued tenant={} queue={} type={} jobId={} priority={}",
                ctx.getTenantId(), message.getQueue(), message.getJobType(), record.getJobId(), message.getPriority());
        eventBus.publish(LeaseRules.enqueued(record));
        return record.getJobId();
    }

    @Override
    public Optional<LeasedJob> dequeue(QueueCtx ctx, Collection<String> queues) throws QueueException {
        Objects.requireNonNull(queues, "queues must not be null");
        if (queues.isEmpty()) {
            return Optional.empty();
        }
        Set<String> queueSet = new HashSet<>(queues);

        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            Instant now = clock.instant();
            JobRecord best = null;
            for (JobRecord record : partition.jobs.values()) {
                if (!queueSet.contains(record.getQueue())) {
                    continue;
                }
                if (record.isLeaseExpired(now)) {
                    reclaim(partition, record, now);
                }
                if (record.isEligible(now) && (best == null || LeaseRules.DEQUEUE_ORDER.compare(record, best) < 0)) {
                    best = record;
                }
            }
            if (best == null) {
                return Optional.empty();
            }

            LeaseToken token = LeaseToken.random();
            best.lease(token, now, config.getLeaseDuration());
            log.debug("Leased tenant={} jobId={} attempt={} leaseUntil={}",
                    ctx.getTenantId(), best.getJobId(), best.getAttemptCount(), best.getLeaseUntil());
            eventBus.publish(LeaseRules.leased(best, now));
            return Optional.of(new LeasedJob(best.getJobId(), token, best.getMessage(),
                    best.getLeaseUntil(), best.getAttemptCount(), best.getTenantId()));
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public void ackComplete(QueueCtx ctx, JobId jobId, LeaseToken token, String resultRef) throws QueueException {
        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = partition.jobs.get(jobId);
            LeaseRules.checkLease(record, jobId, token, now);
            record.markCompleted(resultRef, now);
            log.debug("Completed tenant={} jobId={} attempt={}", ctx.getTenantId(), jobId, record.getAttemptCount());
            eventBus.publish(LeaseRules.completed(record, now));
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public void ackFail(QueueCtx ctx, JobId jobId, LeaseToken token, String error, Instant retryAt) throws QueueException {
        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = partition.jobs.get(jobId);
            LeaseRules.checkLease(record, jobId, token, now);
            JobEvent event = LeaseRules.fail(record, error, retryAt, now);
            afterFailure(partition, record);
            eventBus.publish(event);
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public void heartbeatExtend(QueueCtx ctx, JobId jobId, LeaseToken token, Duration extra) throws QueueException {
        LeaseRules.requireCapability(capabilities, Capability.LEASE_EXTEND, "lease extension");
        Objects.requireNonNull(extra, "extra must not be null");
        if (extra.isNegative()) {
            throw new IllegalArgumentException("extra must not be negative");
        }

        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = partition.jobs.get(jobId);
            LeaseRules.checkLease(record, jobId, token, now);
            record.extendLease(extra, now);
            log.debug("Extended lease tenant={} jobId={} leaseUntil={}", ctx.getTenantId(), jobId, record.getLeaseUntil());
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public boolean cancel(QueueCtx ctx, JobId jobId) throws QueueException {
        LeaseRules.requireCapability(capabilities, Capability.CANCEL, "cancel");

        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            Instant now = clock.instant();
            JobRecord record = partition.jobs.get(jobId);
            if (record == null) {
                throw QueueException.jobNotFound(jobId);
            }
            if (record.isTerminal()) {
                return false;
            }
            JobStatus previous = record.getStatus();
            record.markCanceled(now);
            log.debug("Canceled tenant={} jobId={} previous={}", ctx.getTenantId(), jobId, previous);
            eventBus.publish(LeaseRules.canceled(record, now));
            return true;
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public JobStatus getStatus(QueueCtx ctx, JobId jobId) throws QueueException {
        return getRecord(ctx, jobId).getStatus();
    }

    @Override
    public JobRecord getRecord(QueueCtx ctx, JobId jobId) throws QueueException {
        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            JobRecord record = partition.jobs.get(jobId);
            if (record == null) {
                throw QueueException.jobNotFound(jobId);
            }
            return record.copy();
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public JobEventSubscription eventStream(QueueCtx ctx) {
        return eventBus.subscribe(ctx.getTenantId());
    }

    /**
     * Bus carrying the events of every tenant.
     */
    public JobEventBus getEventBus() {
        return eventBus;
    }

    @Override
    public QueueCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public QueueMetrics metrics(QueueCtx ctx, Collection<String> queues) {
        Set<String> queueSet = new HashSet<>(queues);
        long pending = 0;
        long leased = 0;
        long retrying = 0;
        long completed = 0;
        long failed = 0;
        long canceled = 0;
        long eligible = 0;

        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            Instant now = clock.instant();
            for (JobRecord record : partition.jobs.values()) {
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
            return new QueueMetrics(ctx.getTenantId(), partition.jobs.size(),
                    pending, leased, retrying, completed, failed, canceled, eligible);
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public List<JobRecord> deadLetters(QueueCtx ctx) throws QueueException {
        LeaseRules.requireCapability(capabilities, Capability.DEAD_LETTER_QUEUE, "dead-letter inspection");

        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            List<JobRecord> copies = new ArrayList<>(partition.deadLetters.size());
            for (JobRecord record : partition.deadLetters.values()) {
                copies.add(record.copy());
            }
            copies.sort(Comparator.comparing(JobRecord::getUpdatedAt));
            return copies;
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public JobId replayDeadLetter(QueueCtx ctx, JobId jobId) throws QueueException {
        LeaseRules.requireCapability(capabilities, Capability.DEAD_LETTER_QUEUE, "dead-letter replay");

        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            JobRecord dead = partition.deadLetters.remove(jobId);
            if (dead == null) {
                throw QueueException.jobNotFound(jobId);
            }
            Instant now = clock.instant();
            JobMessage replay = dead.getMessage().toBuilder()
                    .idempotencyKey(null)
                    .runAt(now)
                    .build();
            JobId newId = insert(partition, ctx, replay, now);
            log.info("Replayed dead letter tenant={} jobId={} newJobId={}", ctx.getTenantId(), jobId, newId);
            return newId;
        } finally {
            partition.lock.unlock();
        }
    }

    @Override
    public int recoverExpiredLeases() {
        int recovered = 0;
        for (Partition partition : partitions.values()) {
            partition.lock.lock();
            try {
                Instant now = clock.instant();
                for (JobRecord record : partition.jobs.values()) {
                    if (record.isLeaseExpired(now)) {
                        reclaim(partition, record, now);
                        recovered++;
                    }
                }
            } finally {
                partition.lock.unlock();
            }
        }
        return recovered;
    }

    /**
     * Delete terminal records of a tenant, with the idempotency entries pointing at them.
     * Dead letters stay listed until replayed.
     *
     * @return number of records removed
     */
    public long purgeTerminal(QueueCtx ctx) {
        Partition partition = partition(ctx);
        partition.lock.lock();
        try {
            long purged = 0;
            Iterator<JobRecord> it = partition.jobs.values().iterator();
            while (it.hasNext()) {
                JobRecord record = it.next();
                if (record.isTerminal()) {
                    it.remove();
                    if (record.getMessage().getIdempotencyKey() != null) {
                        partition.idempotencyKeys.remove(
                                IdempotencyScope.of(record.getTenantId(), record.getMessage()), record.getJobId());
                    }
                    purged++;
                }
            }
            log.info("Purged terminal jobs tenant={} count={}", ctx.getTenantId(), purged);
            return purged;
        } finally {
            partition.lock.unlock();
        }
    }

    private void reclaim(Partition partition, JobRecord record, Instant now) {
        int attempt = record.getAttemptCount();
        JobEvent event = LeaseRules.reclaim(record, now);
        log.warn("Reclaimed expired lease tenant={} jobId={} attempt={} status={}",
                record.getTenantId(), record.getJobId(), attempt, record.getStatus());
        afterFailure(partition, record);
        eventBus.publish(event);
    }

    private void afterFailure(Partition partition, JobRecord record) {
        if (record.getStatus() == JobStatus.RETRYING) {
            log.debug("Retry scheduled tenant={} jobId={} attempt={} retryAt={} error={}",
                    record.getTenantId(), record.getJobId(), record.getAttemptCount(),
                    record.getEligibleAt(), record.getLastError());
            return;
        }
        log.debug("Failed tenant={} jobId={} attempt={} error={}",
                record.getTenantId(), record.getJobId(), record.getAttemptCount(), record.getLastError());
        if (capabilities.isDeadLetterQueue()) {
            partition.deadLetters.put(record.getJobId(), record);
        }
    }

    @Override
    public void close() {
        log.info("In-memory backend closed tenants={}", partitions.size());
    }
}
