package com.umitunal.leaseq.core;

import com.umitunal.leaseq.events.JobEventSubscription;
import com.umitunal.leaseq.model.JobRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Tenant-scoped, lease-based job store.
 *
 * <p>Every operation is thread-safe. A job is handed out under an exclusive lease; only the holder
 * of the current {@link LeaseToken} can complete, fail or extend it. Cancellation always wins over
 * a later acknowledgement of the same lease.
 */
public interface QueueBackend extends AutoCloseable {

    /**
     * Submit a job. When the message carries an idempotency key that maps to a non-terminal job in
     * the same tenant, queue and job type, the existing id is returned and nothing is created.
     *
     * @return the id of the new (or deduplicated) job
     * @throws QueueException PAYLOAD_TOO_LARGE when the payload exceeds the configured limit
     */
    JobId enqueue(QueueCtx ctx, JobMessage message) throws QueueException;

    /**
     * Lease the highest-priority, oldest eligible job in the given queues. Never blocks.
     *
     * @return the leased job, or empty when nothing is eligible
     */
    Optional<LeasedJob> dequeue(QueueCtx ctx, Collection<String> queues) throws QueueException;

    /**
     * Mark a leased job completed.
     *
     * @param resultRef encoded result, may be null
     */
    void ackComplete(QueueCtx ctx, JobId jobId, LeaseToken token, String resultRef) throws QueueException;

    /**
     * Report a failed attempt. With a retry time and retries left the job goes to RETRYING,
     * otherwise it fails permanently.
     *
     * @param retryAt earliest time of the next attempt, or null to fail now
     */
    void ackFail(QueueCtx ctx, JobId jobId, LeaseToken token, String error, Instant retryAt) throws QueueException;

    /**
     * Push the lease deadline of a running job further out.
     */
    void heartbeatExtend(QueueCtx ctx, JobId jobId, LeaseToken token, Duration extra) throws QueueException;

    /**
     * Cancel a job in any non-terminal state.
     *
     * @return true if the job transitioned, false if it was already terminal
     */
    boolean cancel(QueueCtx ctx, JobId jobId) throws QueueException;

    JobStatus getStatus(QueueCtx ctx, JobId jobId) throws QueueException;

    /**
     * @return a copy of the stored record
     */
    JobRecord getRecord(QueueCtx ctx, JobId jobId) throws QueueException;

    /**
     * Subscribe to lifecycle events of the context's tenant.
     */
    JobEventSubscription eventStream(QueueCtx ctx);

    QueueCapabilities capabilities();

    /**
     * Status counts for the tenant; eligible depth is limited to {@code queues}.
     */
    QueueMetrics metrics(QueueCtx ctx, Collection<String> queues) throws QueueException;

    /**
     * Jobs that failed permanently, oldest first.
     */
    List<JobRecord> deadLetters(QueueCtx ctx) throws QueueException;

    /**
     * Re-submit a dead-lettered job as a fresh job and drop it from the dead-letter list.
     *
     * @return id of the new job
     */
    JobId replayDeadLetter(QueueCtx ctx, JobId jobId) throws QueueException;

    @Override
    void close();
}
