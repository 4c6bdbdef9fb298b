package com.umitunal.leaseq.core;

/**
 * Lifecycle states of a job.
 */
public enum JobStatus {
    PENDING,     // Waiting for its first lease
    LEASED,      // Claimed by a worker under a lease
    RETRYING,    // Failed, eligible again once its retry time passes
    COMPLETED,   // Successfully completed
    FAILED,      // Failed permanently or ran out of retries
    CANCELED;    // Canceled by a caller

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    /**
     * Whether a job in this state may be picked by dequeue once its eligibility time passes.
     */
    public boolean isWaiting() {
        return this == PENDING || this == RETRYING;
    }
}
