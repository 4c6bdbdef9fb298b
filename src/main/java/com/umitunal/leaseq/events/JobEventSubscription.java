package com.umitunal.leaseq.events;

import com.umitunal.leaseq.core.JobEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A consumer's view of the event stream. Events arrive in publish order; events published while
 * the buffer was full are lost and show up in {@link #getDroppedCount()}.
 */
public class JobEventSubscription implements AutoCloseable {
    private final JobEventBus bus;
    private final String tenantId;
    private final BlockingQueue<JobEvent> buffer;
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    JobEventSubscription(JobEventBus bus, String tenantId, int bufferSize) {
        this.bus = bus;
        this.tenantId = tenantId;
        this.buffer = new ArrayBlockingQueue<>(bufferSize);
    }

    boolean accepts(JobEvent event) {
        return tenantId == null || tenantId.equals(event.getTenantId());
    }

    boolean offer(JobEvent event) {
        if (closed.get()) {
            return true;
        }
        if (buffer.offer(event)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    /**
     * Next buffered event, if any.
     */
    public Optional<JobEvent> poll() {
        return Optional.ofNullable(buffer.poll());
    }

    /**
     * Wait up to {@code timeout} for the next event.
     */
    public Optional<JobEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Remove and return everything currently buffered.
     */
    public List<JobEvent> drain() {
        List<JobEvent> events = new ArrayList<>(buffer.size());
        buffer.drainTo(events);
        return events;
    }

    /**
     * Tenant this subscription is filtered to, or null for all tenants.
     */
    public String getTenantId() { return tenantId; }
    public long getDroppedCount() { return dropped.get(); }
    public int getBufferedCount() { return buffer.size(); }
    public boolean isClosed() { return closed.get(); }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bus.unsubscribe(this);
            buffer.clear();
        }
    }
}
