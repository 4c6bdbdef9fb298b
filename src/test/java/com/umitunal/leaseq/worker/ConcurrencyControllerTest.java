package com.umitunal.leaseq.worker;

import com.umitunal.leaseq.config.AdaptiveConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ConcurrencyControllerTest {

    private static final Duration FAST = Duration.ofMillis(50);
    private static final Duration SLOW = Duration.ofSeconds(5);

    private static ConcurrencyController controller(int min, int max, int initial, int step) {
        return new ConcurrencyController(AdaptiveConfig.newBuilder()
                .withMinConcurrency(min)
                .withMaxConcurrency(max)
                .withInitialConcurrency(initial)
                .withStep(step)
                .withErrorRateThreshold(0.2)
                .withLatencyThreshold(Duration.ofSeconds(1))
                .build());
    }

    private static ConcurrencyController.Signals signals(long depth, Duration latency, double errorRate) {
        return new ConcurrencyController.Signals(depth, latency, errorRate);
    }

    @Test
    @DisplayName("Should grow by step while a healthy backlog exceeds the active count")
    void testScaleUp() {
        // Given
        ConcurrencyController controller = controller(1, 5, 1, 2);

        // Then
        assertThat(controller.adjust(signals(100, FAST, 0.0))).isEqualTo(3);
        assertThat(controller.adjust(signals(100, FAST, 0.0))).isEqualTo(5);
        assertThat(controller.adjust(signals(100, FAST, 0.0))).isEqualTo(5);
    }

    @Test
    @DisplayName("Should not grow when latency is above the threshold or backlog is small")
    void testHoldSteady() {
        ConcurrencyController controller = controller(1, 8, 4, 1);

        assertThat(controller.adjust(signals(100, SLOW, 0.0))).isEqualTo(4);
        assertThat(controller.adjust(signals(4, FAST, 0.0))).isEqualTo(4);
        assertThat(controller.history()).isEmpty();
    }

    @Test
    @DisplayName("Should halve on a high error rate, not below the minimum")
    void testErrorRateBackoff() {
        // Given
        ConcurrencyController controller = controller(2, 16, 16, 1);

        // Then: errors win even with a backlog
        assertThat(controller.adjust(signals(1000, FAST, 0.2))).isEqualTo(8);
        assertThat(controller.adjust(signals(1000, FAST, 0.5))).isEqualTo(4);
        assertThat(controller.adjust(signals(1000, FAST, 0.9))).isEqualTo(2);
        assertThat(controller.adjust(signals(1000, FAST, 0.9))).isEqualTo(2);
    }

    @Test
    @DisplayName("Should shed one slot per round while the queue is empty")
    void testScaleDownWhenIdle() {
        // Given
        ConcurrencyController controller = controller(1, 4, 3, 1);

        // Then
        assertThat(controller.adjust(signals(0, FAST, 0.0))).isEqualTo(2);
        assertThat(controller.adjust(signals(0, FAST, 0.0))).isEqualTo(1);
        assertThat(controller.adjust(signals(0, FAST, 0.0))).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record each change with its reason")
    void testHistory() {
        // Given
        ConcurrencyController controller = controller(1, 4, 2, 1);

        // When
        controller.adjust(signals(10, FAST, 0.0));
        controller.adjust(signals(0, FAST, 0.0));

        // Then
        assertThat(controller.history()).hasSize(2);
        ConcurrencyController.Adjustment first = controller.history().get(0);
        assertThat(first.getFrom()).isEqualTo(2);
        assertThat(first.getTo()).isEqualTo(3);
        assertThat(first.getReason()).contains("backlog");
        assertThat(controller.history().get(1).getReason()).isEqualTo("queue empty");
    }

    @Test
    @DisplayName("Should keep a bounded history")
    void testHistoryBounded() {
        ConcurrencyController controller = controller(1, 2, 1, 1);

        for (int i = 0; i < 100; i++) {
            controller.adjust(signals(i % 2 == 0 ? 10 : 0, FAST, 0.0));
        }

        assertThat(controller.history()).hasSize(64);
    }
}
