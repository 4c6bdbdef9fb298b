package com.umitunal.leaseq.model;

import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.JobStatus;
import com.umitunal.leaseq.core.LeaseToken;

import java.time.Duration;
import java.time.Instant;

/**
 * Backend-owned lifecycle record of a single job.
 *
 * <p>Instances are mutated only inside a backend's critical section; callers receive
 * {@link #copy()}s.
 */
public class JobRecord {
    private final JobId jobId;
    private final String tenantId;
    private final JobMessage message;
    private final Instant createdAt;
    private final long sequence;

    private JobStatus status;
    private int attemptCount;
    private String lastError;
    private LeaseToken leaseToken;
    private Instant leaseUntil;
    private Instant eligibleAt;
    private Instant updatedAt;
    private String resultRef;
    private long version;  // Bumped on every transition

    public JobRecord(JobId jobId, String tenantId, JobMessage message, Instant createdAt, long sequence) {
        this.jobId = jobId;
        this.tenantId = tenantId;
        this.message = message.getRunAt() != null ? message : message.withRunAt(createdAt);
        this.createdAt = createdAt;
        this.sequence = sequence;
        this.status = JobStatus.PENDING;
        this.attemptCount = 0;
        this.eligibleAt = this.message.getRunAt();
        this.updatedAt = createdAt;
        this.version = 0;
    }

    public JobId getJobId() { return jobId; }
    public String getTenantId() { return tenantId; }
    public JobMessage getMessage() { return message; }
    public Instant getCreatedAt() { return createdAt; }
    public long getSequence() { return sequence; }
    public JobStatus getStatus() { return status; }
    public int getAttemptCount() { return attemptCount; }
    public String getLastError() { return lastError; }
    public LeaseToken getLeaseToken() { return leaseToken; }
    public Instant getLeaseUntil() { return leaseUntil; }
    public Instant getEligibleAt() { return eligibleAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public String getResultRef() { return resultRef; }
    public long getVersion() { return version; }

    public String getQueue() {
        return message.getQueue();
    }

    public String getJobType() {
        return message.getJobType();
    }

    // Package-private setters for deserialization
    void setStatus(JobStatus status) {
        this.status = status;
    }

    void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void setLeaseToken(LeaseToken leaseToken) {
        this.leaseToken = leaseToken;
    }

    void setLeaseUntil(Instant leaseUntil) {
        this.leaseUntil = leaseUntil;
    }

    void setEligibleAt(Instant eligibleAt) {
        this.eligibleAt = eligibleAt;
    }

    void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    void setResultRef(String resultRef) {
        this.resultRef = resultRef;
    }

    void setVersion(long version) {
        this.version = version;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasLease() {
        return leaseToken != null;
    }

    /**
     * A LEASED record whose deadline has been reached.
     */
    public boolean isLeaseExpired(Instant now) {
        return status == JobStatus.LEASED && leaseUntil != null && !now.isBefore(leaseUntil);
    }

    /**
     * Whether another attempt is allowed after the current one.
     */
    public boolean canRetry() {
        return attemptCount <= message.getMaxRetries();
    }

    /**
     * Whether a dequeue at {@code now} may hand this job out.
     */
    public boolean isEligible(Instant now) {
        if (status.isWaiting()) {
            return !eligibleAt.isAfter(now);
        }
        return isLeaseExpired(now);
    }

    public boolean isHeldBy(LeaseToken token) {
        return leaseToken != null && leaseToken.equals(token);
    }

    public void lease(LeaseToken token, Instant now, Duration leaseDuration) {
        this.leaseToken = token;
        this.leaseUntil = now.plus(leaseDuration);
        this.status = JobStatus.LEASED;
        this.attemptCount++;
        touch(now);
    }

    public void extendLease(Duration extra, Instant now) {
        this.leaseUntil = leaseUntil.plus(extra);
        touch(now);
    }

    public void markCompleted(String resultRef, Instant now) {
        this.resultRef = resultRef;
        this.status = JobStatus.COMPLETED;
        clearLease();
        touch(now);
    }

    public void scheduleRetry(String error, Instant retryAt, Instant now) {
        this.lastError = error;
        this.eligibleAt = retryAt;
        this.status = JobStatus.RETRYING;
        clearLease();
        touch(now);
    }

    public void markFailed(String error, Instant now) {
        this.lastError = error;
        this.status = JobStatus.FAILED;
        clearLease();
        touch(now);
    }

    public void markCanceled(Instant now) {
        this.status = JobStatus.CANCELED;
        clearLease();
        touch(now);
    }

    private void clearLease() {
        this.leaseToken = null;
        this.leaseUntil = null;
    }

    private void touch(Instant now) {
        this.updatedAt = now;
        this.version++;
    }

    public JobRecord copy() {
        JobRecord copy = new JobRecord(jobId, tenantId, message, createdAt, sequence);
        copy.status = status;
        copy.attemptCount = attemptCount;
        copy.lastError = lastError;
        copy.leaseToken = leaseToken;
        copy.leaseUntil = leaseUntil;
        copy.eligibleAt = eligibleAt;
        copy.updatedAt = updatedAt;
        copy.resultRef = resultRef;
        copy.version = version;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id=%s, tenant='%s', type='%s', status=%s, attempt=%d/%d, eligibleAt=%s}",
                jobId, tenantId, message.getJobType(), status, attemptCount, message.getMaxRetries() + 1, eligibleAt);
    }
}
