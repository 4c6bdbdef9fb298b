package com.umitunal.leaseq.job;

import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.LeasedJob;
import com.umitunal.leaseq.core.QueueBackend;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.core.QueueException;

import java.time.Duration;
import java.time.Instant;

/**
 * What a running job knows about its own execution.
 */
public class JobContext {
    private final QueueBackend backend;
    private final QueueCtx ctx;
    private final LeasedJob leased;
    private volatile Instant leaseUntil;

    public JobContext(QueueBackend backend, QueueCtx ctx, LeasedJob leased) {
        this.backend = backend;
        this.ctx = ctx;
        this.leased = leased;
        this.leaseUntil = leased.getLeaseUntil();
    }

    public JobId getJobId() { return leased.getJobId(); }
    public QueueCtx getCtx() { return ctx; }
    public int getAttemptCount() { return leased.getAttemptCount(); }
    public Instant getLeaseUntil() { return leaseUntil; }

    public boolean isLastAttempt() {
        return leased.getAttemptCount() > leased.getMessage().getMaxRetries();
    }

    /**
     * Heartbeat: push the lease deadline out by {@code extra}.
     */
    public void extendLease(Duration extra) throws QueueException {
        backend.heartbeatExtend(ctx, leased.getJobId(), leased.getLeaseToken(), extra);
        leaseUntil = leaseUntil.plus(extra);
    }
}
