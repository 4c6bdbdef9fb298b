package com.umitunal.leaseq.observability;

import com.umitunal.leaseq.core.JobEvent;
import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.LeasedJob;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.events.JobEventBus;
import com.umitunal.leaseq.events.JobEventSubscription;
import com.umitunal.leaseq.config.BackendConfig;
import com.umitunal.leaseq.storage.InMemoryQueueBackend;
import com.umitunal.leaseq.support.MutableClock;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.umitunal.leaseq.support.Messages.message;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class JobEventMetricsTest {

    private SimpleMeterRegistry registry;
    private JobEventMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new JobEventMetrics(registry);
    }

    @Test
    @DisplayName("Should count each lifecycle event by job type")
    void testCountsByType() throws Exception {
        // Given
        MutableClock clock = MutableClock.startingNow();
        InMemoryQueueBackend backend = new InMemoryQueueBackend(BackendConfig.newBuilder().withClock(clock).build());
        QueueCtx ctx = QueueCtx.of("tenant-a");
        JobEventSubscription events = backend.eventStream(ctx);

        JobId ok = backend.enqueue(ctx, message(clock, "email"));
        LeasedJob first = backend.dequeue(ctx, List.of(JobMessage.DEFAULT_QUEUE)).orElseThrow();
        clock.advance(Duration.ofMillis(250));
        backend.ackComplete(ctx, ok, first.getLeaseToken(), null);

        JobId flaky = backend.enqueue(ctx, message(clock, "sms"));
        LeasedJob second = backend.dequeue(ctx, List.of(JobMessage.DEFAULT_QUEUE)).orElseThrow();
        backend.ackFail(ctx, flaky, second.getLeaseToken(), "timeout", clock.instant());

        // When
        int counted = metrics.drain(events);

        // Then
        assertThat(counted).isEqualTo(6);
        assertThat(registry.get(JobEventMetrics.ENQUEUED_TOTAL).tag("type", "email").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(JobEventMetrics.RETRIED_TOTAL).tag("type", "sms").counter().count()).isEqualTo(1.0);

        Timer duration = registry.get(JobEventMetrics.DURATION).tag("type", "email").timer();
        assertThat(duration.count()).isEqualTo(1);
        assertThat(duration.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);

        QueueAnalytics totals = metrics.snapshot();
        assertThat(totals.getEnqueued()).isEqualTo(2);
        assertThat(totals.getLeased()).isEqualTo(2);
        assertThat(totals.getCompleted()).isEqualTo(1);
        assertThat(totals.getRetried()).isEqualTo(1);
        assertThat(totals.retryRate()).isEqualTo(0.5);
        assertThat(totals.inFlight()).isEqualTo(1);
        assertThat(metrics.snapshot("email").successRate()).isEqualTo(1.0);
        assertThat(metrics.snapshot("missing").getEnqueued()).isZero();
        backend.close();
    }

    @Test
    @DisplayName("Should ignore redelivered events")
    void testDeduplication() {
        // Given
        JobEvent event = JobEvent.completed(JobId.of("job-1"), "t", "q", "email", Instant.EPOCH);

        // Then
        assertThat(metrics.record(event)).isTrue();
        assertThat(metrics.record(event)).isFalse();
        assertThat(metrics.getDuplicateCount()).isEqualTo(1);
        assertThat(metrics.snapshot().getCompleted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should forget old dedup keys beyond its capacity")
    void testDedupCapacity() {
        // Given
        JobEventMetrics small = new JobEventMetrics(new SimpleMeterRegistry(), 2);
        JobEvent a = JobEvent.enqueued(JobId.of("a"), "t", "q", "x", Instant.EPOCH);
        JobEvent b = JobEvent.enqueued(JobId.of("b"), "t", "q", "x", Instant.EPOCH);
        JobEvent c = JobEvent.enqueued(JobId.of("c"), "t", "q", "x", Instant.EPOCH);

        // When
        small.record(a);
        small.record(b);
        small.record(c);

        // Then
        assertThat(small.record(a)).isTrue();
        assertThat(small.record(c)).isFalse();
    }

    @Test
    @DisplayName("Should expose dropped events as a gauge")
    void testDroppedGauge() {
        // Given
        JobEventBus bus = new JobEventBus(1);
        JobEventSubscription subscription = bus.subscribe("t");
        metrics.bindDropped(subscription, "dashboard");

        // When
        bus.publish(JobEvent.enqueued(JobId.of("a"), "t", "q", "x", Instant.EPOCH));
        bus.publish(JobEvent.enqueued(JobId.of("b"), "t", "q", "x", Instant.EPOCH));

        // Then
        assertThat(registry.get(JobEventMetrics.DROPPED).tag("subscriber", "dashboard").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should derive zero rates when nothing happened")
    void testEmptyAnalytics() {
        QueueAnalytics empty = new QueueAnalytics(0, 0, 0, 0, 0, 0);

        assertThat(empty.successRate()).isZero();
        assertThat(empty.retryRate()).isZero();
        assertThat(empty.inFlight()).isZero();
    }

    @Test
    @DisplayName("Should count events from a background consumer until stopped")
    void testBackgroundConsumer() {
        // Given
        JobEventBus bus = new JobEventBus(16);
        JobEventSubscription subscription = bus.subscribe("t");

        // When
        metrics.start(subscription, "background");
        bus.publish(JobEvent.enqueued(JobId.of("a"), "t", "q", "email", Instant.EPOCH));
        bus.publish(JobEvent.enqueued(JobId.of("b"), "t", "q", "email", Instant.EPOCH));

        // Then
        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(metrics.snapshot("email").getEnqueued()).isEqualTo(2));
        assertThat(metrics.isRunning()).isTrue();
        assertThatThrownBy(() -> metrics.start(subscription, "again"))
                .isInstanceOf(IllegalStateException.class);

        metrics.stop();
        assertThat(metrics.isRunning()).isFalse();
        metrics.stop();
        assertThat(registry.get(JobEventMetrics.DROPPED).tag("subscriber", "background").gauge().value()).isZero();
    }
}
