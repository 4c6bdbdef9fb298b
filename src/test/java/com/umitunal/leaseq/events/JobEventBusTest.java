package com.umitunal.leaseq.events;

import com.umitunal.leaseq.core.JobEvent;
import com.umitunal.leaseq.core.JobId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JobEventBusTest {

    private static JobEvent enqueued(String tenantId, int n) {
        return JobEvent.enqueued(JobId.of("job-" + n), tenantId, "default", "t", Instant.EPOCH.plusSeconds(n));
    }

    @Test
    @DisplayName("Should deliver only the subscribed tenant's events, in order")
    void testTenantFiltering() {
        // Given
        JobEventBus bus = new JobEventBus(16);
        JobEventSubscription tenantA = bus.subscribe("a");
        JobEventSubscription everyone = bus.subscribeAll();

        // When
        bus.publish(enqueued("a", 1));
        bus.publish(enqueued("b", 2));
        bus.publish(enqueued("a", 3));

        // Then
        assertThat(tenantA.drain()).extracting(e -> e.getJobId().value()).containsExactly("job-1", "job-3");
        assertThat(everyone.drain()).hasSize(3);
        assertThat(everyone.getTenantId()).isNull();
        assertThat(bus.getPublishedCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should drop events for a full subscriber without blocking others")
    void testDropWhenFull() {
        // Given
        JobEventBus bus = new JobEventBus(2);
        JobEventSubscription slow = bus.subscribe("a");

        // When
        for (int i = 0; i < 5; i++) {
            bus.publish(enqueued("a", i));
        }
        JobEventSubscription late = bus.subscribe("a");
        bus.publish(enqueued("a", 99));

        // Then
        assertThat(slow.getBufferedCount()).isEqualTo(2);
        assertThat(slow.getDroppedCount()).isEqualTo(4);
        assertThat(bus.getDroppedCount()).isEqualTo(4);
        assertThat(slow.drain()).extracting(e -> e.getJobId().value()).containsExactly("job-0", "job-1");
        assertThat(late.poll()).map(e -> e.getJobId().value()).contains("job-99");
    }

    @Test
    @DisplayName("Should stop delivering after close")
    void testClose() throws Exception {
        // Given
        JobEventBus bus = new JobEventBus(4);
        JobEventSubscription subscription = bus.subscribe("a");

        // When
        subscription.close();
        bus.publish(enqueued("a", 1));

        // Then
        assertThat(subscription.isClosed()).isTrue();
        assertThat(bus.getSubscriberCount()).isZero();
        assertThat(subscription.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    @DisplayName("Should wait for the next event with a timeout")
    void testTimedPoll() throws Exception {
        // Given
        JobEventBus bus = new JobEventBus(4);
        JobEventSubscription subscription = bus.subscribe("a");
        Thread publisher = new Thread(() -> bus.publish(enqueued("a", 1)));

        // When
        publisher.start();

        // Then
        assertThat(subscription.poll(Duration.ofSeconds(5))).isPresent();
        publisher.join();
    }
}
