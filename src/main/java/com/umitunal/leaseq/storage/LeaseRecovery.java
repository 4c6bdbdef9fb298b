package com.umitunal.leaseq.storage;

import com.umitunal.leaseq.core.QueueException;

/**
 * Backends that can reclaim expired leases eagerly instead of waiting for the next dequeue.
 */
public interface LeaseRecovery {

    /**
     * Reclaim every LEASED job whose lease has elapsed.
     *
     * @return number of jobs reclaimed
     */
    int recoverExpiredLeases() throws QueueException;
}
