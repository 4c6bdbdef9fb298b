package com.umitunal.leaseq.worker;

import com.umitunal.leaseq.config.WorkerConfig;
import com.umitunal.leaseq.core.JobException;
import com.umitunal.leaseq.core.JobId;
import com.umitunal.leaseq.core.LeasedJob;
import com.umitunal.leaseq.core.QueueBackend;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.core.QueueErrorKind;
import com.umitunal.leaseq.core.QueueException;
import com.umitunal.leaseq.job.Job;
import com.umitunal.leaseq.job.JobContext;
import com.umitunal.leaseq.job.JobRegistry;
import com.umitunal.leaseq.serialization.CodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one leased job and reports its outcome to the backend.
 *
 * <p>Jobs run on a separate pool so the caller can enforce the timeout. Success is acknowledged
 * with the encoded result. Retryable failures, timeouts and unexpected exceptions are failed with
 * a backoff retry time while retries remain. Permanent failures, undecodable payloads and unknown
 * job types are failed without one. When the backend rejects the acknowledgement because the job
 * was canceled, already finished or lost its lease, the outcome is discarded.
 */
public class JobRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final AtomicInteger POOL_IDS = new AtomicInteger(0);

    public enum Outcome {
        COMPLETED,
        RETRIED,
        FAILED,
        DISCARDED;

        public boolean isError() {
            return this == RETRIED || this == FAILED;
        }
    }

    public static final class Result {
        private final JobId jobId;
        private final Outcome outcome;
        private final Duration latency;

        Result(JobId jobId, Outcome outcome, Duration latency) {
            this.jobId = jobId;
            this.outcome = outcome;
            this.latency = latency;
        }

        public JobId getJobId() { return jobId; }
        public Outcome getOutcome() { return outcome; }
        public Duration getLatency() { return latency; }

        @Override
        public String toString() {
            return String.format("Result{job=%s, outcome=%s, latency=%dms}", jobId, outcome, latency.toMillis());
        }
    }

    private final QueueBackend backend;
    private final QueueCtx ctx;
    private final JobRegistry registry;
    private final CodecRegistry codecs;
    private final WorkerConfig config;
    private final Clock clock;
    private final ExecutorService executionPool;

    public JobRunner(QueueBackend backend, QueueCtx ctx, JobRegistry registry, CodecRegistry codecs, WorkerConfig config) {
        this(backend, ctx, registry, codecs, config, Clock.systemUTC());
    }

    public JobRunner(QueueBackend backend, QueueCtx ctx, JobRegistry registry, CodecRegistry codecs,
                     WorkerConfig config, Clock clock) {
        this.backend = backend;
        this.ctx = ctx;
        this.registry = registry;
        this.codecs = codecs;
        this.config = config;
        this.clock = clock;

        String poolName = "leaseq-exec-" + POOL_IDS.incrementAndGet();
        AtomicInteger threadIds = new AtomicInteger(0);
        this.executionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName(poolName + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run and acknowledge one job.
     *
     * @throws QueueException when the acknowledgement fails for a reason other than a lost lease or a
     *                        canceled/finished job
     */
    public Result run(LeasedJob leased) throws QueueException {
        return run(leased, () -> { });
    }

    /**
     * Run and acknowledge one job, calling {@code beforeAck} once execution has finished.
     */
    public Result run(LeasedJob leased, Runnable beforeAck) throws QueueException {
        long started = System.nanoTime();
        Outcome outcome = execute(leased, beforeAck);
        return new Result(leased.getJobId(), outcome, Duration.ofNanos(System.nanoTime() - started));
    }

    private Outcome execute(LeasedJob leased, Runnable beforeAck) throws QueueException {
        JobContext context = new JobContext(backend, ctx, leased);
        Duration timeout = registry.find(leased.getJobType())
                .flatMap(Job::timeout)
                .orElse(config.getJobTimeout());

        log.debug("Executing jobId={} type={} attempt={}", leased.getJobId(), leased.getJobType(), leased.getAttemptCount());
        Future<String> future = executionPool.submit(() -> registry.dispatch(leased, codecs, context));
        String resultRef;
        try {
            resultRef = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            beforeAck.run();
            return fail(leased, "Timed out after " + timeout.toMillis() + "ms", true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while running jobId={}, leaving it to lease expiry", leased.getJobId());
            return Outcome.DISCARDED;
        } catch (ExecutionException e) {
            beforeAck.run();
            return classify(leased, e.getCause());
        }
        beforeAck.run();
        return complete(leased, resultRef);
    }

    private Outcome classify(LeasedJob leased, Throwable cause) throws QueueException {
        if (cause instanceof JobException jobError) {
            return fail(leased, jobError.getMessage(), jobError.isRetryable());
        }
        if (cause instanceof QueueException queueError) {
            return fail(leased, queueError.getMessage(), !queueError.getKind().isPermanentForJob());
        }
        log.warn("Unexpected exception from jobId={} type={}", leased.getJobId(), leased.getJobType(), cause);
        return fail(leased, cause.getClass().getSimpleName() + ": " + cause.getMessage(), true);
    }

    private Outcome complete(LeasedJob leased, String resultRef) throws QueueException {
        try {
            backend.ackComplete(ctx, leased.getJobId(), leased.getLeaseToken(), resultRef);
        } catch (QueueException e) {
            return discard(leased, e);
        }
        log.debug("Completed jobId={} attempt={}", leased.getJobId(), leased.getAttemptCount());
        return Outcome.COMPLETED;
    }

    private Outcome fail(LeasedJob leased, String error, boolean retryable) throws QueueException {
        Instant retryAt = null;
        if (retryable) {
            retryAt = config.getRetryBackoff()
                    .retryAt(leased.getAttemptCount(), leased.getMessage().getMaxRetries(), clock.instant())
                    .orElse(null);
        }
        try {
            backend.ackFail(ctx, leased.getJobId(), leased.getLeaseToken(), error, retryAt);
        } catch (QueueException e) {
            return discard(leased, e);
        }
        if (retryAt != null) {
            log.warn("Job failed, retrying jobId={} attempt={} retryAt={} error={}",
                    leased.getJobId(), leased.getAttemptCount(), retryAt, error);
            return Outcome.RETRIED;
        }
        log.error("Job failed permanently jobId={} type={} attempt={} error={}",
                leased.getJobId(), leased.getJobType(), leased.getAttemptCount(), error);
        return Outcome.FAILED;
    }

    private Outcome discard(LeasedJob leased, QueueException e) throws QueueException {
        QueueErrorKind.Category category = e.getKind().category();
        if (category == QueueErrorKind.Category.STATE_CONFLICT
                || category == QueueErrorKind.Category.LEASE
                || category == QueueErrorKind.Category.NOT_FOUND) {
            log.warn("Dropping outcome of jobId={}: {}", leased.getJobId(), e.getMessage());
            return Outcome.DISCARDED;
        }
        throw e;
    }

    @Override
    public void close() {
        executionPool.shutdownNow();
    }
}
