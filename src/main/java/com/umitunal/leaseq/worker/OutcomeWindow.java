package com.umitunal.leaseq.worker;

import java.time.Duration;

/**
 * Ring buffer of the most recent job outcomes.
 */
public class OutcomeWindow {
    private final long[] latencies;
    private final boolean[] errors;
    private int next;
    private int size;

    public OutcomeWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.latencies = new long[capacity];
        this.errors = new boolean[capacity];
    }

    public synchronized void record(Duration latency, boolean error) {
        latencies[next] = latency.toNanos();
        errors[next] = error;
        next = (next + 1) % latencies.length;
        if (size < latencies.length) {
            size++;
        }
    }

    public synchronized Duration averageLatency() {
        if (size == 0) {
            return Duration.ZERO;
        }
        long total = 0;
        for (int i = 0; i < size; i++) {
            total += latencies[i];
        }
        return Duration.ofNanos(total / size);
    }

    /**
     * Fraction of recorded outcomes that were errors, 0 when empty.
     */
    public synchronized double errorRate() {
        if (size == 0) {
            return 0.0;
        }
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (errors[i]) {
                count++;
            }
        }
        return (double) count / size;
    }

    public synchronized int size() {
        return size;
    }

    public synchronized void clear() {
        next = 0;
        size = 0;
    }
}
