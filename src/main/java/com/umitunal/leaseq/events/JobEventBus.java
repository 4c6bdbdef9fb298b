package com.umitunal.leaseq.events;

import com.umitunal.leaseq.core.JobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process fan-out of job events.
 *
 * <p>Each subscriber owns a bounded buffer. Publishing never blocks: when a subscriber's buffer
 * is full the event is dropped for that subscriber and counted.
 */
public class JobEventBus {
    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final int bufferSize;
    private final List<JobEventSubscription> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong published = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);

    public JobEventBus(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        this.bufferSize = bufferSize;
    }

    /**
     * Subscribe to the events of a single tenant.
     */
    public JobEventSubscription subscribe(String tenantId) {
        return register(new JobEventSubscription(this, tenantId, bufferSize));
    }

    /**
     * Subscribe to the events of every tenant.
     */
    public JobEventSubscription subscribeAll() {
        return register(new JobEventSubscription(this, null, bufferSize));
    }

    private JobEventSubscription register(JobEventSubscription subscription) {
        subscribers.add(subscription);
        log.debug("Event subscriber added tenant={} subscribers={}", subscription.getTenantId(), subscribers.size());
        return subscription;
    }

    public void publish(JobEvent event) {
        published.incrementAndGet();
        for (JobEventSubscription subscription : subscribers) {
            if (!subscription.accepts(event)) {
                continue;
            }
            if (!subscription.offer(event)) {
                long total = dropped.incrementAndGet();
                if (subscription.getDroppedCount() == 1) {
                    log.warn("Event subscriber buffer full, dropping events tenant={} bufferSize={} totalDropped={}",
                            subscription.getTenantId(), bufferSize, total);
                }
            }
        }
    }

    void unsubscribe(JobEventSubscription subscription) {
        subscribers.remove(subscription);
    }

    public int getSubscriberCount() { return subscribers.size(); }
    public long getPublishedCount() { return published.get(); }
    public long getDroppedCount() { return dropped.get(); }
}
