package com.umitunal.leaseq.worker;

import com.umitunal.leaseq.config.AdaptiveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Decides how many worker slots should be active.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>error rate at or above the threshold: halve, not below min</li>
 *   <li>nothing queued: drop one slot, not below min</li>
 *   <li>backlog above the active count with healthy errors and latency: add {@code step}, not above max</li>
 * </ol>
 */
public class ConcurrencyController {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyController.class);
    private static final int HISTORY_LIMIT = 64;

    private final AdaptiveConfig config;
    private final Deque<Adjustment> history = new ArrayDeque<>();
    private int current;

    public ConcurrencyController(AdaptiveConfig config) {
        this.config = config;
        this.current = config.getInitialConcurrency();
    }

    public synchronized int current() {
        return current;
    }

    /**
     * Apply one round of the rules.
     *
     * @return the active slot count after the adjustment
     */
    public synchronized int adjust(Signals signals) {
        int target = current;
        String reason = null;

        if (signals.getErrorRate() >= config.getErrorRateThreshold()) {
            target = Math.max(config.getMinConcurrency(), current / 2);
            reason = "error rate " + String.format("%.2f", signals.getErrorRate());
        } else if (signals.getQueueDepth() == 0) {
            target = Math.max(config.getMinConcurrency(), current - 1);
            reason = "queue empty";
        } else if (signals.getQueueDepth() > current
                && signals.getAverageLatency().compareTo(config.getLatencyThreshold()) <= 0) {
            target = Math.min(config.getMaxConcurrency(), current + config.getStep());
            reason = "backlog " + signals.getQueueDepth();
        }

        if (target != current) {
            Adjustment adjustment = new Adjustment(current, target, reason, Instant.now());
            log.info("Concurrency {} -> {} ({})", current, target, reason);
            history.addLast(adjustment);
            if (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
            current = target;
        }
        return current;
    }

    /**
     * Most recent adjustments, oldest first.
     */
    public synchronized List<Adjustment> history() {
        return new ArrayList<>(history);
    }

    /**
     * Inputs to one adjustment round.
     */
    public static final class Signals {
        private final long queueDepth;
        private final Duration averageLatency;
        private final double errorRate;

        public Signals(long queueDepth, Duration averageLatency, double errorRate) {
            this.queueDepth = queueDepth;
            this.averageLatency = averageLatency;
            this.errorRate = errorRate;
        }

        public long getQueueDepth() { return queueDepth; }
        public Duration getAverageLatency() { return averageLatency; }
        public double getErrorRate() { return errorRate; }

        @Override
        public String toString() {
            return String.format("Signals{depth=%d, latency=%s, errorRate=%.2f}", queueDepth, averageLatency, errorRate);
        }
    }

    public static final class Adjustment {
        private final int from;
        private final int to;
        private final String reason;
        private final Instant at;

        Adjustment(int from, int to, String reason, Instant at) {
            this.from = from;
            this.to = to;
            this.reason = reason;
            this.at = at;
        }

        public int getFrom() { return from; }
        public int getTo() { return to; }
        public String getReason() { return reason; }
        public Instant getAt() { return at; }
    }
}
