package com.umitunal.leaseq.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds and thresholds for adaptive worker concurrency.
 */
public class AdaptiveConfig {
    private final int minConcurrency;
    private final int maxConcurrency;
    private final int initialConcurrency;
    private final double errorRateThreshold;
    private final Duration latencyThreshold;
    private final int step;
    private final Duration adjustInterval;
    private final int windowSize;

    private AdaptiveConfig(Builder builder) {
        this.minConcurrency = builder.minConcurrency;
        this.maxConcurrency = builder.maxConcurrency;
        this.initialConcurrency = builder.initialConcurrency != null ? builder.initialConcurrency : builder.minConcurrency;
        this.errorRateThreshold = builder.errorRateThreshold;
        this.latencyThreshold = builder.latencyThreshold;
        this.step = builder.step;
        this.adjustInterval = builder.adjustInterval;
        this.windowSize = builder.windowSize;
    }

    public int getMinConcurrency() { return minConcurrency; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public int getInitialConcurrency() { return initialConcurrency; }
    public double getErrorRateThreshold() { return errorRateThreshold; }
    public Duration getLatencyThreshold() { return latencyThreshold; }
    public int getStep() { return step; }
    public Duration getAdjustInterval() { return adjustInterval; }
    public int getWindowSize() { return windowSize; }

    public static AdaptiveConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int minConcurrency = 1;
        private int maxConcurrency = 8;
        private Integer initialConcurrency;
        private double errorRateThreshold = 0.2;
        private Duration latencyThreshold = Duration.ofSeconds(30);
        private int step = 1;
        private Duration adjustInterval = Duration.ofSeconds(1);
        private int windowSize = 100;

        private Builder() {
        }

        /**
         * Default: 1
         */
        public Builder withMinConcurrency(int min) {
            this.minConcurrency = min;
            return this;
        }

        /**
         * Default: 8
         */
        public Builder withMaxConcurrency(int max) {
            this.maxConcurrency = max;
            return this;
        }

        /**
         * Default: the minimum
         */
        public Builder withInitialConcurrency(int initial) {
            this.initialConcurrency = initial;
            return this;
        }

        /**
         * Error rate at which concurrency is halved.
         * Default: 0.2
         */
        public Builder withErrorRateThreshold(double threshold) {
            this.errorRateThreshold = threshold;
            return this;
        }

        /**
         * Average latency above which concurrency is not increased.
         * Default: 30 seconds
         */
        public Builder withLatencyThreshold(Duration threshold) {
            this.latencyThreshold = Objects.requireNonNull(threshold, "threshold must not be null");
            return this;
        }

        /**
         * Slots added per scale-up.
         * Default: 1
         */
        public Builder withStep(int step) {
            this.step = step;
            return this;
        }

        /**
         * Default: 1 second
         */
        public Builder withAdjustInterval(Duration interval) {
            this.adjustInterval = Objects.requireNonNull(interval, "interval must not be null");
            return this;
        }

        /**
         * Number of recent outcomes used for latency and error rate.
         * Default: 100
         */
        public Builder withWindowSize(int size) {
            this.windowSize = size;
            return this;
        }

        public AdaptiveConfig build() {
            if (minConcurrency < 1) {
                throw new IllegalArgumentException("minConcurrency must be at least 1");
            }
            if (maxConcurrency < minConcurrency) {
                throw new IllegalArgumentException("maxConcurrency must not be below minConcurrency");
            }
            if (initialConcurrency != null
                    && (initialConcurrency < minConcurrency || initialConcurrency > maxConcurrency)) {
                throw new IllegalArgumentException("initialConcurrency must be within [min, max]");
            }
            if (errorRateThreshold <= 0 || errorRateThreshold > 1) {
                throw new IllegalArgumentException("errorRateThreshold must be in (0, 1]");
            }
            if (step < 1) {
                throw new IllegalArgumentException("step must be at least 1");
            }
            if (windowSize < 1) {
                throw new IllegalArgumentException("windowSize must be at least 1");
            }
            if (adjustInterval.isZero() || adjustInterval.isNegative()) {
                throw new IllegalArgumentException("adjustInterval must be positive");
            }
            return new AdaptiveConfig(this);
        }
    }
}
