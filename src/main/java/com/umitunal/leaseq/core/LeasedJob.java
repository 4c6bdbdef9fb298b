package com.umitunal.leaseq.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A job handed to a worker by dequeue, together with the lease that proves the claim.
 */
public final class LeasedJob {
    private final JobId jobId;
    private final LeaseToken leaseToken;
    private final JobMessage message;
    private final Instant leaseUntil;
    private final int attemptCount;
    private final String tenantId;

    public LeasedJob(JobId jobId, LeaseToken leaseToken, JobMessage message,
                     Instant leaseUntil, int attemptCount, String tenantId) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.leaseToken = Objects.requireNonNull(leaseToken, "leaseToken must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.leaseUntil = Objects.requireNonNull(leaseUntil, "leaseUntil must not be null");
        this.attemptCount = attemptCount;
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
    }

    public JobId getJobId() { return jobId; }
    public LeaseToken getLeaseToken() { return leaseToken; }
    public JobMessage getMessage() { return message; }
    public Instant getLeaseUntil() { return leaseUntil; }
    public int getAttemptCount() { return attemptCount; }
    public String getTenantId() { return tenantId; }

    public String getJobType() {
        return message.getJobType();
    }

    @Override
    public String toString() {
        return String.format("LeasedJob{id=%s, type='%s', attempt=%d/%d, leaseUntil=%s}",
                jobId, message.getJobType(), attemptCount, message.getMaxRetries() + 1, leaseUntil);
    }
}
