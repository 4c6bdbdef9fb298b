package com.umitunal.leaseq.worker;

import com.umitunal.leaseq.core.QueueException;
import com.umitunal.leaseq.storage.LeaseRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically reclaims expired leases so abandoned jobs become eligible without waiting for a dequeue.
 */
public class LeaseReaper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final LeaseRecovery recovery;
    private final Duration interval;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong reclaimed = new AtomicLong(0);
    private ScheduledExecutorService scheduler;

    public LeaseReaper(LeaseRecovery recovery, Duration interval) {
        this.recovery = Objects.requireNonNull(recovery, "recovery must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("leaseq-reaper");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Lease reaper started interval={}", interval);
    }

    /**
     * Reclaim once. Failures are logged, never thrown, so the schedule keeps running.
     *
     * @return jobs reclaimed in this pass
     */
    public int runOnce() {
        try {
            int count = recovery.recoverExpiredLeases();
            if (count > 0) {
                reclaimed.addAndGet(count);
                log.info("Reclaimed expired leases count={}", count);
            }
            return count;
        } catch (QueueException | RuntimeException e) {
            log.error("Lease recovery failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        log.info("Lease reaper stopped reclaimed={}", reclaimed.get());
    }

    public long getReclaimedCount() { return reclaimed.get(); }

    @Override
    public void close() {
        stop();
    }
}
