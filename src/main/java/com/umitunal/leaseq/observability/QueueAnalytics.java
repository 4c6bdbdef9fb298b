package com.umitunal.leaseq.observability;

/**
 * Outcome totals with derived success and retry rates.
 */
public class QueueAnalytics {
    private final long enqueued;
    private final long leased;
    private final long completed;
    private final long failed;
    private final long retried;
    private final long canceled;

    public QueueAnalytics(long enqueued, long leased, long completed, long failed, long retried, long canceled) {
        this.enqueued = enqueued;
        this.leased = leased;
        this.completed = completed;
        this.failed = failed;
        this.retried = retried;
        this.canceled = canceled;
    }

    public long getEnqueued() { return enqueued; }
    public long getLeased() { return leased; }
    public long getCompleted() { return completed; }
    public long getFailed() { return failed; }
    public long getRetried() { return retried; }
    public long getCanceled() { return canceled; }

    /**
     * Completed over finished (completed + failed); 0 when nothing has finished.
     */
    public double successRate() {
        long finished = completed + failed;
        return finished == 0 ? 0.0 : (double) completed / finished;
    }

    /**
     * Share of attempts that ended in a retry; 0 when nothing was leased.
     */
    public double retryRate() {
        return leased == 0 ? 0.0 : (double) retried / leased;
    }

    /**
     * Jobs enqueued but not yet completed, failed or canceled.
     */
    public long inFlight() {
        return Math.max(0, enqueued - completed - failed - canceled);
    }

    @Override
    public String toString() {
        return String.format(
            "QueueAnalytics{enqueued=%d, leased=%d, completed=%d, failed=%d, retried=%d, canceled=%d, success=%.2f, retry=%.2f}",
            enqueued, leased, completed, failed, retried, canceled, successRate(), retryRate()
        );
    }
}
