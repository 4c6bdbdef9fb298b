package com.umitunal.leaseq.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable job submission: what to run, how it is encoded, and where it goes.
 *
 * <p>The payload is opaque to the queue. {@link #getCodec()} names the codec that produced it
 * so a worker can decode it without knowing the producer.
 */
public final class JobMessage {
    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final String jobType;
    private final String codec;
    private final byte[] payload;
    private final String queue;
    private final JobPriority priority;
    private final int maxRetries;
    private final Instant runAt;
    private final String idempotencyKey;

    private JobMessage(Builder builder) {
        this.jobType = builder.jobType;
        this.codec = builder.codec;
        this.payload = builder.payload.clone();
        this.queue = builder.queue;
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
        this.runAt = builder.runAt;
        this.idempotencyKey = builder.idempotencyKey;
    }

    public String getJobType() { return jobType; }
    public String getCodec() { return codec; }
    public String getQueue() { return queue; }
    public JobPriority getPriority() { return priority; }
    public int getMaxRetries() { return maxRetries; }
    /**
     * Earliest eligibility time, or null when the backend should use its own clock at enqueue.
     */
    public Instant getRunAt() { return runAt; }
    public String getIdempotencyKey() { return idempotencyKey; }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public int getPayloadSize() {
        return payload.length;
    }

    /**
     * Copy of this message with a different earliest-eligibility time.
     */
    public JobMessage withRunAt(Instant runAt) {
        return toBuilder().runAt(runAt).build();
    }

    public Builder toBuilder() {
        return new Builder(jobType, codec, payload)
                .queue(queue)
                .priority(priority)
                .maxRetries(maxRetries)
                .runAt(runAt)
                .idempotencyKey(idempotencyKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobMessage other)) return false;
        return maxRetries == other.maxRetries
                && jobType.equals(other.jobType)
                && codec.equals(other.codec)
                && Arrays.equals(payload, other.payload)
                && queue.equals(other.queue)
                && priority == other.priority
                && Objects.equals(runAt, other.runAt)
                && Objects.equals(idempotencyKey, other.idempotencyKey);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(jobType, codec, queue, priority, maxRetries, runAt, idempotencyKey);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return String.format("JobMessage{type='%s', codec='%s', queue='%s', priority=%s, maxRetries=%d, runAt=%s, bytes=%d}",
                jobType, codec, queue, priority, maxRetries, runAt, payload.length);
    }

    public static Builder builder(String jobType, String codec, byte[] payload) {
        return new Builder(jobType, codec, payload);
    }

    public static class Builder {
        private final String jobType;
        private final String codec;
        private final byte[] payload;
        private String queue = DEFAULT_QUEUE;
        private JobPriority priority = JobPriority.NORMAL;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Instant runAt;
        private String idempotencyKey;

        private Builder(String jobType, String codec, byte[] payload) {
            this.jobType = Objects.requireNonNull(jobType, "jobType must not be null");
            this.codec = Objects.requireNonNull(codec, "codec must not be null");
            this.payload = Objects.requireNonNull(payload, "payload must not be null");
        }

        /**
         * Target queue name.
         * Default: "default"
         */
        public Builder queue(String queue) {
            this.queue = Objects.requireNonNull(queue, "queue must not be null");
            return this;
        }

        /**
         * Default: NORMAL
         */
        public Builder priority(JobPriority priority) {
            this.priority = Objects.requireNonNull(priority, "priority must not be null");
            return this;
        }

        /**
         * Number of retries after the first attempt.
         * Default: 3
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Earliest time the job may be leased.
         * Default: the backend's clock when the job is enqueued
         */
        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = (idempotencyKey == null || idempotencyKey.isBlank()) ? null : idempotencyKey;
            return this;
        }

        public JobMessage build() {
            if (jobType.isBlank()) {
                throw new IllegalArgumentException("jobType must not be blank");
            }
            if (queue.isBlank()) {
                throw new IllegalArgumentException("queue must not be blank");
            }
            return new JobMessage(this);
        }
    }
}
