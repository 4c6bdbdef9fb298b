package com.umitunal.leaseq.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by every queue backend.
 */
public class BackendConfig {
    private final Duration leaseDuration;
    private final int maxPayloadBytes;
    private final boolean deadLetterQueue;
    private final int eventBufferSize;
    private final Clock clock;

    private BackendConfig(Builder builder) {
        this.leaseDuration = builder.leaseDuration;
        this.maxPayloadBytes = builder.maxPayloadBytes;
        this.deadLetterQueue = builder.deadLetterQueue;
        this.eventBufferSize = builder.eventBufferSize;
        this.clock = builder.clock;
    }

    public Duration getLeaseDuration() { return leaseDuration; }
    public int getMaxPayloadBytes() { return maxPayloadBytes; }
    public boolean isDeadLetterQueue() { return deadLetterQueue; }
    public int getEventBufferSize() { return eventBufferSize; }
    public Clock getClock() { return clock; }

    public static BackendConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Duration leaseDuration = Duration.ofSeconds(30);
        private int maxPayloadBytes = 1024 * 1024;
        private boolean deadLetterQueue = true;
        private int eventBufferSize = 1024;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * How long a dequeued job stays leased without a heartbeat.
         * Default: 30 seconds
         */
        public Builder withLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = Objects.requireNonNull(leaseDuration, "leaseDuration must not be null");
            return this;
        }

        /**
         * Largest accepted payload.
         * Default: 1 MiB
         */
        public Builder withMaxPayloadBytes(int maxPayloadBytes) {
            this.maxPayloadBytes = maxPayloadBytes;
            return this;
        }

        /**
         * Keep permanently failed jobs for inspection and replay.
         * Default: true
         */
        public Builder withDeadLetterQueue(boolean enable) {
            this.deadLetterQueue = enable;
            return this;
        }

        /**
         * Events buffered per subscriber before new ones are dropped.
         * Default: 1024
         */
        public Builder withEventBufferSize(int size) {
            this.eventBufferSize = size;
            return this;
        }

        /**
         * Time source for lease deadlines and eligibility.
         * Default: system UTC clock
         */
        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public BackendConfig build() {
            if (leaseDuration.isZero() || leaseDuration.isNegative()) {
                throw new IllegalArgumentException("leaseDuration must be positive");
            }
            if (maxPayloadBytes <= 0) {
                throw new IllegalArgumentException("maxPayloadBytes must be positive");
            }
            if (eventBufferSize <= 0) {
                throw new IllegalArgumentException("eventBufferSize must be positive");
            }
            return new BackendConfig(this);
        }
    }
}
