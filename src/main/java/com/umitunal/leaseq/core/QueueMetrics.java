package com.umitunal.leaseq.core;

/**
 * Per-tenant snapshot of job counts by status.
 */
public class QueueMetrics {
    private final String tenantId;
    private final long totalJobs;
    private final long pendingJobs;
    private final long leasedJobs;
    private final long retryingJobs;
    private final long completedJobs;
    private final long failedJobs;
    private final long canceledJobs;
    private final long eligibleDepth;

    public QueueMetrics(String tenantId, long totalJobs, long pendingJobs, long leasedJobs,
                        long retryingJobs, long completedJobs, long failedJobs, long canceledJobs,
                        long eligibleDepth) {
        this.tenantId = tenantId;
        this.totalJobs = totalJobs;
        this.pendingJobs = pendingJobs;
        this.leasedJobs = leasedJobs;
        this.retryingJobs = retryingJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
        this.canceledJobs = canceledJobs;
        this.eligibleDepth = eligibleDepth;
    }

    public String getTenantId() { return tenantId; }
    public long getTotalJobs() { return totalJobs; }
    public long getPendingJobs() { return pendingJobs; }
    public long getLeasedJobs() { return leasedJobs; }
    public long getRetryingJobs() { return retryingJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }
    public long getCanceledJobs() { return canceledJobs; }

    /**
     * Jobs in the requested queues that a dequeue could hand out right now.
     */
    public long getEligibleDepth() { return eligibleDepth; }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{tenant='%s', total=%d, pending=%d, leased=%d, retrying=%d, completed=%d, failed=%d, canceled=%d, eligible=%d}",
            tenantId, totalJobs, pendingJobs, leasedJobs, retryingJobs, completedJobs, failedJobs, canceledJobs, eligibleDepth
        );
    }
}
