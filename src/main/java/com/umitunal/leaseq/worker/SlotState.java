package com.umitunal.leaseq.worker;

/**
 * What a worker slot is doing right now.
 */
public enum SlotState {
    IDLE,       // Waiting before the next poll
    POLLING,    // Calling dequeue
    EXECUTING,  // Running a leased job
    ACKING,     // Reporting the outcome
    PARKED,     // Above the adaptive concurrency limit
    STOPPED
}
