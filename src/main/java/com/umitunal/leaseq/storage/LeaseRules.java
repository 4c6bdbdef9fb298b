package com.umitunal.leaseq.storage;

import com.umitunal.leaseq.core.JobEvent;
import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.JobStatus;
import com.umitunal.leaseq.core.LeaseToken;
import com.umitunal.leaseq.core.QueueCapabilities;
import com.umitunal.leaseq.core.QueueException;
import com.umitunal.leaseq.model.JobRecord;

import java.time.Instant;
import java.util.Comparator;

/**
 * Transition rules shared by the backends. Callers hold their write lock.
 */
final class LeaseRules {

    static final String LEASE_EXPIRED_ERROR = "lease expired";
    static final String LEASE_EXPIRED_EXHAUSTED_ERROR = "Max retries exceeded due to lease expiry";

    /**
     * Highest priority first, then oldest, then first enqueued.
     */
    static final Comparator<JobRecord> DEQUEUE_ORDER =
            Comparator.comparingInt((JobRecord r) -> r.getMessage().getPriority().value()).reversed()
                    .thenComparing(JobRecord::getCreatedAt)
                    .thenComparingLong(JobRecord::getSequence);

    private LeaseRules() {
    }

    static void requireCapability(QueueCapabilities capabilities, QueueCapabilities.Capability capability,
                                  String operation) throws QueueException {
        if (!capabilities.supports(capability)) {
            throw QueueException.unsupported(operation);
        }
    }

    static void checkPayload(JobMessage message, int maxPayloadBytes) throws QueueException {
        if (message.getPayloadSize() > maxPayloadBytes) {
            throw QueueException.payloadTooLarge(message.getPayloadSize(), maxPayloadBytes);
        }
    }

    /**
     * Validate that {@code token} may acknowledge {@code record} at {@code now}.
     * A canceled job always reports JOB_CANCELED, whatever the token.
     */
    static void checkLease(JobRecord record, JobId jobId, LeaseToken token, Instant now) throws QueueException {
        if (record == null) {
            throw QueueException.jobNotFound(jobId);
        }
        JobStatus status = record.getStatus();
        if (status == JobStatus.CANCELED) {
            throw QueueException.jobCanceled(jobId);
        }
        if (status.isTerminal()) {
            throw QueueException.alreadyTerminal(jobId, status);
        }
        if (status != JobStatus.LEASED || !record.isHeldBy(token)) {
            throw QueueException.invalidLeaseToken(jobId);
        }
        if (record.isLeaseExpired(now)) {
            throw QueueException.leaseExpired(jobId);
        }
    }

    /**
     * Apply a failed attempt: RETRYING when a retry time is given and attempts remain, FAILED otherwise.
     */
    static JobEvent fail(JobRecord record, String error, Instant retryAt, Instant now) {
        if (retryAt != null && record.canRetry()) {
            record.scheduleRetry(error, retryAt, now);
            return JobEvent.retrying(record.getJobId(), record.getTenantId(), record.getQueue(),
                    record.getJobType(), now, retryAt, error);
        }
        record.markFailed(error, now);
        return JobEvent.failed(record.getJobId(), record.getTenantId(), record.getQueue(),
                record.getJobType(), now, error);
    }

    /**
     * Reclaim an expired lease: immediately eligible again while attempts remain, FAILED otherwise.
     */
    static JobEvent reclaim(JobRecord record, Instant now) {
        String error = record.canRetry() ? LEASE_EXPIRED_ERROR : LEASE_EXPIRED_EXHAUSTED_ERROR;
        return fail(record, error, now, now);
    }

    static JobEvent leased(JobRecord record, Instant now) {
        return JobEvent.leased(record.getJobId(), record.getTenantId(), record.getQueue(),
                record.getJobType(), now, record.getLeaseUntil());
    }

    static JobEvent completed(JobRecord record, Instant now) {
        return JobEvent.completed(record.getJobId(), record.getTenantId(), record.getQueue(),
                record.getJobType(), now);
    }

    static JobEvent canceled(JobRecord record, Instant now) {
        return JobEvent.canceled(record.getJobId(), record.getTenantId(), record.getQueue(),
                record.getJobType(), now);
    }

    static JobEvent enqueued(JobRecord record) {
        return JobEvent.enqueued(record.getJobId(), record.getTenantId(), record.getQueue(),
                record.getJobType(), record.getCreatedAt());
    }
}
