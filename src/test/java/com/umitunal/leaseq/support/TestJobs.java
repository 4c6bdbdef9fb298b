package com.umitunal.leaseq.support;

import com.umitunal.leaseq.core.JobException;
import com.umitunal.leaseq.job.Job;
import com.umitunal.leaseq.job.JobContext;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small String-payload jobs for worker and registry tests.
 */
public final class TestJobs {

    private TestJobs() {
    }

    /**
     * Upper-cases its payload.
     */
    public static class UpperCaseJob implements Job<String, String> {
        public static final String TYPE = "upper";
        private final AtomicInteger executions = new AtomicInteger();

        @Override
        public String jobType() {
            return TYPE;
        }

        @Override
        public Class<String> payloadType() {
            return String.class;
        }

        @Override
        public String execute(String payload, JobContext context) {
            executions.incrementAndGet();
            return payload.toUpperCase();
        }

        public int getExecutions() {
            return executions.get();
        }
    }

    /**
     * Throws a retryable error until it has failed {@code failures} times.
     */
    public static class FlakyJob implements Job<String, Void> {
        public static final String TYPE = "flaky";
        private final int failures;
        private final AtomicInteger attempts = new AtomicInteger();

        public FlakyJob(int failures) {
            this.failures = failures;
        }

        @Override
        public String jobType() {
            return TYPE;
        }

        @Override
        public Class<String> payloadType() {
            return String.class;
        }

        @Override
        public Void execute(String payload, JobContext context) throws JobException {
            if (attempts.incrementAndGet() <= failures) {
                throw JobException.retryable("transient failure " + attempts.get());
            }
            return null;
        }

        public int getAttempts() {
            return attempts.get();
        }
    }

    /**
     * Always fails permanently.
     */
    public static class RejectingJob implements Job<String, Void> {
        public static final String TYPE = "reject";

        @Override
        public String jobType() {
            return TYPE;
        }

        @Override
        public Class<String> payloadType() {
            return String.class;
        }

        @Override
        public Void execute(String payload, JobContext context) throws JobException {
            throw JobException.permanent("invalid payload: " + payload);
        }
    }

    /**
     * Throws an unchecked exception.
     */
    public static class CrashingJob implements Job<String, Void> {
        public static final String TYPE = "crash";

        @Override
        public String jobType() {
            return TYPE;
        }

        @Override
        public Class<String> payloadType() {
            return String.class;
        }

        @Override
        public Void execute(String payload, JobContext context) {
            throw new IllegalStateException("unexpected");
        }
    }

    /**
     * Blocks until released, or until interrupted.
     */
    public static class BlockingJob implements Job<String, Void> {
        public static final String TYPE = "blocking";
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final Duration timeout;

        public BlockingJob(Duration timeout) {
            this.timeout = timeout;
        }

        @Override
        public String jobType() {
            return TYPE;
        }

        @Override
        public Class<String> payloadType() {
            return String.class;
        }

        @Override
        public Optional<Duration> timeout() {
            return Optional.ofNullable(timeout);
        }

        @Override
        public Void execute(String payload, JobContext context) throws JobException {
            started.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw JobException.retryable("interrupted");
            }
            return null;
        }

        public boolean awaitStarted(Duration wait) throws InterruptedException {
            return started.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        }

        public void release() {
            release.countDown();
        }
    }
}
