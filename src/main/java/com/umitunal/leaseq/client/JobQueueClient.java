package com.umitunal.leaseq.client;

import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.JobMessage;
import com.umitunal.leaseq.core.JobPriority;
import com.umitunal.leaseq.core.JobStatus;
import com.umitunal.leaseq.core.QueueBackend;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.core.QueueException;
import com.umitunal.leaseq.job.Job;
import com.umitunal.leaseq.job.JobRegistry;
import com.umitunal.leaseq.model.JobRecord;
import com.umitunal.leaseq.serialization.CodecRegistry;
import com.umitunal.leaseq.serialization.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Producer-side entry point: encodes typed payloads and submits them.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobId id = client.create(ctx, sendEmail, new EmailPayload("a@b.c"))
 *         .priority(JobPriority.HIGH)
 *         .idempotencyKey("welcome-42")
 *         .delay(Duration.ofMinutes(5))
 *         .submit();
 * }</pre>
 */
public class JobQueueClient {
    private static final Logger log = LoggerFactory.getLogger(JobQueueClient.class);

    private final QueueBackend backend;
    private final CodecRegistry codecs;
    private final int maxPayloadBytes;
    private final Clock clock;

    public JobQueueClient(QueueBackend backend, CodecRegistry codecs, int maxPayloadBytes) {
        this(backend, codecs, maxPayloadBytes, Clock.systemUTC());
    }

    public JobQueueClient(QueueBackend backend, CodecRegistry codecs, int maxPayloadBytes, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.codecs = Objects.requireNonNull(codecs, "codecs must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive");
        }
        this.maxPayloadBytes = maxPayloadBytes;
    }

    /**
     * Start a submission that takes its defaults (priority, max retries) from the job.
     */
    public <P> Submission create(QueueCtx ctx, Job<P, ?> job, P payload) {
        Objects.requireNonNull(job, "job must not be null");
        return new Submission(ctx, job.jobType(), payload)
                .priority(job.priority())
                .maxRetries(job.maxRetries());
    }

    /**
     * Start a submission for a job type known only by name.
     */
    public Submission create(QueueCtx ctx, String jobType, Object payload) {
        return new Submission(ctx, jobType, payload);
    }

    /**
     * Submit with the job's defaults.
     */
    public <P> JobId submit(QueueCtx ctx, Job<P, ?> job, P payload) throws QueueException {
        return create(ctx, job, payload).submit();
    }

    public boolean cancel(QueueCtx ctx, JobId jobId) throws QueueException {
        return backend.cancel(ctx, jobId);
    }

    public JobStatus status(QueueCtx ctx, JobId jobId) throws QueueException {
        return backend.getStatus(ctx, jobId);
    }

    /**
     * Decode the result of a completed job with the codec it was submitted with.
     *
     * @return the result, or null if the job has not completed or returned nothing
     */
    public <R> R result(QueueCtx ctx, JobId jobId, Class<R> type) throws QueueException {
        JobRecord record = backend.getRecord(ctx, jobId);
        if (record.getStatus() != JobStatus.COMPLETED) {
            return null;
        }
        return JobRegistry.decodeResult(record.getResultRef(), codecs.get(record.getMessage().getCodec()), type);
    }

    public class Submission {
        private final QueueCtx ctx;
        private final String jobType;
        private final Object payload;
        private String codecId;
        private String queue = JobMessage.DEFAULT_QUEUE;
        private JobPriority priority = JobPriority.NORMAL;
        private int maxRetries = JobMessage.DEFAULT_MAX_RETRIES;
        private Instant runAt;
        private Duration delay;
        private String idempotencyKey;

        private Submission(QueueCtx ctx, String jobType, Object payload) {
            this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
            this.jobType = Objects.requireNonNull(jobType, "jobType must not be null");
            this.payload = payload;
            this.codecId = codecs.defaultCodec().id();
        }

        public Submission codec(String codecId) {
            this.codecId = Objects.requireNonNull(codecId, "codecId must not be null");
            return this;
        }

        public Submission queue(String queue) {
            this.queue = Objects.requireNonNull(queue, "queue must not be null");
            return this;
        }

        public Submission priority(JobPriority priority) {
            this.priority = Objects.requireNonNull(priority, "priority must not be null");
            return this;
        }

        public Submission maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Run no earlier than {@code runAt}.
         */
        public Submission schedule(Instant runAt) {
            this.runAt = Objects.requireNonNull(runAt, "runAt must not be null");
            this.delay = null;
            return this;
        }

        /**
         * Run no earlier than {@code delay} from submission.
         */
        public Submission delay(Duration delay) {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            this.delay = delay;
            this.runAt = null;
            return this;
        }

        public Submission idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        /**
         * Encode the payload and enqueue it.
         *
         * @throws QueueException CODEC_NOT_FOUND, SERIALIZATION_ERROR or PAYLOAD_TOO_LARGE before
         *                        anything is enqueued
         */
        public JobId submit() throws QueueException {
            PayloadCodec codec = codecs.get(codecId);
            byte[] bytes = codec.encode(payload);
            if (bytes.length > maxPayloadBytes) {
                throw QueueException.payloadTooLarge(bytes.length, maxPayloadBytes);
            }

            Instant now = clock.instant();
            Instant effectiveRunAt = runAt != null ? runAt : (delay != null ? now.plus(delay) : now);
            JobMessage message = JobMessage.builder(jobType, codec.id(), bytes)
                    .queue(queue)
                    .priority(priority)
                    .maxRetries(maxRetries)
                    .runAt(effectiveRunAt)
                    .idempotencyKey(idempotencyKey)
                    .build();

            JobId jobId = backend.enqueue(ctx, message);
            log.debug("Submitted tenant={} type={} jobId={} runAt={}", ctx.getTenantId(), jobType, jobId, effectiveRunAt);
            return jobId;
        }
    }
}
