package com.umitunal.leaseq.observability;

import com.umitunal.leaseq.core.JobEvent;
import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.events.JobEventSubscription;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Micrometer counters driven by the job event stream.
 *
 * <p>Events may be delivered more than once, so each one is checked against a bounded set of
 * recently seen dedup keys before it is counted. Events are fed either by the caller through
 * {@link #record(JobEvent)} and {@link #drain(JobEventSubscription)}, or by a background consumer
 * started with {@link #start(JobEventSubscription, String)}.
 */
public class JobEventMetrics implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobEventMetrics.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(200);

    static final String ENQUEUED_TOTAL = "leaseq_jobs_enqueued_total";
    static final String LEASED_TOTAL = "leaseq_jobs_leased_total";
    static final String COMPLETED_TOTAL = "leaseq_jobs_completed_total";
    static final String FAILED_TOTAL = "leaseq_jobs_failed_total";
    static final String RETRIED_TOTAL = "leaseq_jobs_retried_total";
    static final String CANCELED_TOTAL = "leaseq_jobs_canceled_total";
    static final String DUPLICATES = "leaseq_events_duplicate_total";
    static final String DURATION = "leaseq_job_duration_seconds";
    static final String DROPPED = "leaseq_events_dropped";

    private static final int DEFAULT_DEDUP_CAPACITY = 10_000;

    private final MeterRegistry registry;
    private final Counter duplicates;
    private final Map<String, Boolean> seen;
    private final Map<JobId, Instant> leasedAt = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumer;

    public JobEventMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_DEDUP_CAPACITY);
    }

    public JobEventMetrics(MeterRegistry registry, int dedupCapacity) {
        this.registry = registry;
        this.duplicates = Counter.builder(DUPLICATES)
                .description("redelivered events ignored").register(registry);
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > dedupCapacity;
            }
        };
    }

    /**
     * Count one event.
     *
     * @return false if the event was a duplicate and ignored
     */
    public boolean record(JobEvent event) {
        synchronized (seen) {
            if (seen.putIfAbsent(event.dedupKey(), Boolean.TRUE) != null) {
                duplicates.increment();
                return false;
            }
        }

        String type = event.getJobType() != null ? event.getJobType() : "unknown";
        switch (event.getKind()) {
            case ENQUEUED -> counter(ENQUEUED_TOTAL, "jobs enqueued", type).increment();
            case LEASED -> {
                counter(LEASED_TOTAL, "jobs leased", type).increment();
                leasedAt.put(event.getJobId(), event.getAt());
            }
            case COMPLETED -> {
                counter(COMPLETED_TOTAL, "jobs completed", type).increment();
                stopTimer(event, type);
            }
            case FAILED -> {
                counter(FAILED_TOTAL, "jobs failed permanently", type).increment();
                stopTimer(event, type);
            }
            case RETRYING -> {
                counter(RETRIED_TOTAL, "jobs scheduled for retry", type).increment();
                stopTimer(event, type);
            }
            case CANCELED -> {
                counter(CANCELED_TOTAL, "jobs canceled", type).increment();
                leasedAt.remove(event.getJobId());
            }
        }
        return true;
    }

    /**
     * Record everything currently buffered in the subscription.
     *
     * @return number of events counted, duplicates excluded
     */
    public int drain(JobEventSubscription subscription) {
        int counted = 0;
        for (JobEvent event : subscription.drain()) {
            if (record(event)) {
                counted++;
            }
        }
        return counted;
    }

    /**
     * Consume {@code subscription} on a daemon thread until {@link #stop()} or until the
     * subscription is closed. Also binds its dropped-event gauge under {@code name}.
     */
    public synchronized void start(JobEventSubscription subscription, String name) {
        Objects.requireNonNull(subscription, "subscription must not be null");
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Metrics consumer already running");
        }
        bindDropped(subscription, name);
        consumer = new Thread(() -> consume(subscription), "leaseq-metrics-" + name);
        consumer.setDaemon(true);
        consumer.start();
        log.info("Metrics consumer started subscriber={} tenant={}", name, subscription.getTenantId());
    }

    private void consume(JobEventSubscription subscription) {
        while (running.get() && !subscription.isClosed()) {
            try {
                Optional<JobEvent> event = subscription.poll(POLL_TIMEOUT);
                event.ifPresent(this::record);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Failed to record event", e);
            }
        }
        running.set(false);
    }

    /**
     * Stop the background consumer and wait for it to exit. Calling it again has no effect.
     */
    public synchronized void stop() {
        if (consumer == null) {
            return;
        }
        running.set(false);
        consumer.interrupt();
        try {
            consumer.join(POLL_TIMEOUT.toMillis() * 5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        consumer = null;
        log.info("Metrics consumer stopped");
    }

    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    /**
     * Expose the subscription's dropped-event count as a gauge.
     */
    public void bindDropped(JobEventSubscription subscription, String name) {
        Gauge.builder(DROPPED, subscription, JobEventSubscription::getDroppedCount)
                .description("events dropped because the subscriber fell behind")
                .tag("subscriber", name)
                .register(registry);
    }

    /**
     * Totals across all job types.
     */
    public QueueAnalytics snapshot() {
        return new QueueAnalytics(
                total(ENQUEUED_TOTAL), total(LEASED_TOTAL), total(COMPLETED_TOTAL),
                total(FAILED_TOTAL), total(RETRIED_TOTAL), total(CANCELED_TOTAL));
    }

    /**
     * Totals for one job type.
     */
    public QueueAnalytics snapshot(String jobType) {
        return new QueueAnalytics(
                count(ENQUEUED_TOTAL, jobType), count(LEASED_TOTAL, jobType), count(COMPLETED_TOTAL, jobType),
                count(FAILED_TOTAL, jobType), count(RETRIED_TOTAL, jobType), count(CANCELED_TOTAL, jobType));
    }

    public long getDuplicateCount() {
        return (long) duplicates.count();
    }

    private void stopTimer(JobEvent event, String type) {
        Instant started = leasedAt.remove(event.getJobId());
        if (started != null) {
            Timer.builder(DURATION)
                    .description("time from lease to outcome by type")
                    .tag("type", type)
                    .register(registry)
                    .record(Duration.between(started, event.getAt()));
        }
    }

    private Counter counter(String name, String description, String type) {
        return Counter.builder(name)
                .description(description)
                .tag("type", type)
                .register(registry);
    }

    private long total(String name) {
        double sum = 0;
        for (Counter counter : registry.find(name).counters()) {
            sum += counter.count();
        }
        return (long) sum;
    }

    private long count(String name, String type) {
        Counter counter = registry.find(name).tag("type", type).counter();
        return counter != null ? (long) counter.count() : 0;
    }
}
