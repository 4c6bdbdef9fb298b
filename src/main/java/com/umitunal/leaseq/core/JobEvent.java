package com.umitunal.leaseq.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A lifecycle transition observed on the event stream.
 *
 * <p>Kind-specific fields are null when they do not apply: {@code leaseUntil} is set only on
 * LEASED, {@code retryAt} only on RETRYING and {@code error} on RETRYING and FAILED.
 * Delivery is at-least-once, so consumers dedupe on {@link #dedupKey()}.
 */
public final class JobEvent {

    public enum Kind {
        ENQUEUED,
        LEASED,
        RETRYING,
        COMPLETED,
        FAILED,
        CANCELED
    }

    private final Kind kind;
    private final JobId jobId;
    private final String tenantId;
    private final String queue;
    private final String jobType;
    private final Instant at;
    private final Instant leaseUntil;
    private final Instant retryAt;
    private final String error;

    private JobEvent(Kind kind, JobId jobId, String tenantId, String queue, String jobType,
                     Instant at, Instant leaseUntil, Instant retryAt, String error) {
        this.kind = kind;
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.tenantId = tenantId;
        this.queue = queue;
        this.jobType = jobType;
        this.at = Objects.requireNonNull(at, "at must not be null");
        this.leaseUntil = leaseUntil;
        this.retryAt = retryAt;
        this.error = error;
    }

    public static JobEvent enqueued(JobId jobId, String tenantId, String queue, String jobType, Instant at) {
        return new JobEvent(Kind.ENQUEUED, jobId, tenantId, queue, jobType, at, null, null, null);
    }

    public static JobEvent leased(JobId jobId, String tenantId, String queue, String jobType,
                                  Instant at, Instant leaseUntil) {
        return new JobEvent(Kind.LEASED, jobId, tenantId, queue, jobType, at, leaseUntil, null, null);
    }

    public static JobEvent retrying(JobId jobId, String tenantId, String queue, String jobType,
                                    Instant at, Instant retryAt, String error) {
        return new JobEvent(Kind.RETRYING, jobId, tenantId, queue, jobType, at, null, retryAt, error);
    }

    public static JobEvent completed(JobId jobId, String tenantId, String queue, String jobType, Instant at) {
        return new JobEvent(Kind.COMPLETED, jobId, tenantId, queue, jobType, at, null, null, null);
    }

    public static JobEvent failed(JobId jobId, String tenantId, String queue, String jobType,
                                  Instant at, String error) {
        return new JobEvent(Kind.FAILED, jobId, tenantId, queue, jobType, at, null, null, error);
    }

    public static JobEvent canceled(JobId jobId, String tenantId, String queue, String jobType, Instant at) {
        return new JobEvent(Kind.CANCELED, jobId, tenantId, queue, jobType, at, null, null, null);
    }

    public Kind getKind() { return kind; }
    public JobId getJobId() { return jobId; }
    public String getTenantId() { return tenantId; }
    public String getQueue() { return queue; }
    public String getJobType() { return jobType; }
    public Instant getAt() { return at; }
    public Instant getLeaseUntil() { return leaseUntil; }
    public Instant getRetryAt() { return retryAt; }
    public String getError() { return error; }

    /**
     * Identity of the transition, equal for redelivered copies of the same event.
     */
    public String dedupKey() {
        return jobId.value() + "|" + kind + "|" + at.toEpochMilli() + "." + at.getNano();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobEvent other)) return false;
        return kind == other.kind
                && jobId.equals(other.jobId)
                && at.equals(other.at)
                && Objects.equals(tenantId, other.tenantId)
                && Objects.equals(leaseUntil, other.leaseUntil)
                && Objects.equals(retryAt, other.retryAt)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, jobId, at);
    }

    @Override
    public String toString() {
        return String.format("JobEvent{kind=%s, job=%s, tenant='%s', queue='%s', type='%s', at=%s}",
                kind, jobId, tenantId, queue, jobType, at);
    }
}
