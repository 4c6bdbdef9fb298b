package com.umitunal.leaseq.config;

import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.worker.RetryBackoff;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Polling, timeout and retry settings of a worker.
 */
public class WorkerConfig {
    private final String workerId;
    private final List<String> queues;
    private final Duration pollInterval;
    private final Duration maxIdleInterval;
    private final Duration jobTimeout;
    private final Duration shutdownGrace;
    private final RetryBackoff retryBackoff;

    private WorkerConfig(Builder builder) {
        this.workerId = builder.workerId;
        this.queues = List.copyOf(builder.queues);
        this.pollInterval = builder.pollInterval;
        this.maxIdleInterval = builder.maxIdleInterval;
        this.jobTimeout = builder.jobTimeout;
        this.shutdownGrace = builder.shutdownGrace;
        this.retryBackoff = builder.retryBackoff;
    }

    public String getWorkerId() { return workerId; }
    public List<String> getQueues() { return queues; }
    public Duration getPollInterval() { return pollInterval; }
    public Duration getMaxIdleInterval() { return maxIdleInterval; }
    public Duration getJobTimeout() { return jobTimeout; }
    public Duration getShutdownGrace() { return shutdownGrace; }
    public RetryBackoff getRetryBackoff() { return retryBackoff; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        private List<String> queues = List.of(JobMessage.DEFAULT_QUEUE);
        private Duration pollInterval = Duration.ofMillis(100);
        private Duration maxIdleInterval = Duration.ofSeconds(2);
        private Duration jobTimeout = Duration.ofMinutes(5);
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private RetryBackoff retryBackoff = RetryBackoff.defaults();

        private Builder() {
        }

        /**
         * Default: "worker-" + random suffix
         */
        public Builder withWorkerId(String workerId) {
            this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
            return this;
        }

        /**
         * Queues polled by the worker.
         * Default: ["default"]
         */
        public Builder withQueues(List<String> queues) {
            this.queues = Objects.requireNonNull(queues, "queues must not be null");
            return this;
        }

        /**
         * Wait after an empty poll. Doubles on consecutive empty polls.
         * Default: 100 ms
         */
        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
            return this;
        }

        /**
         * Upper bound for the idle wait.
         * Default: 2 seconds
         */
        public Builder withMaxIdleInterval(Duration maxIdleInterval) {
            this.maxIdleInterval = Objects.requireNonNull(maxIdleInterval, "maxIdleInterval must not be null");
            return this;
        }

        /**
         * Execution timeout for jobs that do not declare their own.
         * Default: 5 minutes
         */
        public Builder withJobTimeout(Duration jobTimeout) {
            this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout must not be null");
            return this;
        }

        /**
         * How long stop waits for in-flight jobs.
         * Default: 10 seconds
         */
        public Builder withShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace must not be null");
            return this;
        }

        public Builder withRetryBackoff(RetryBackoff retryBackoff) {
            this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff must not be null");
            return this;
        }

        public WorkerConfig build() {
            if (queues.isEmpty()) {
                throw new IllegalArgumentException("queues must not be empty");
            }
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            if (maxIdleInterval.compareTo(pollInterval) < 0) {
                throw new IllegalArgumentException("maxIdleInterval must not be shorter than pollInterval");
            }
            if (jobTimeout.isNegative() || jobTimeout.isZero()) {
                throw new IllegalArgumentException("jobTimeout must be positive");
            }
            return new WorkerConfig(this);
        }
    }
}
