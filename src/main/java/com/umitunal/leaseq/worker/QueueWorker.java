package com.umitunal.leaseq.worker;

import com.umitunal.leaseq.config.WorkerConfig;
import com.umitunal.leaseq.core.LeasedJob;
import com.umitunal.leaseq.core.QueueBackend;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.core.QueueErrorKind;
import com.umitunal.leaseq.core.QueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A single worker slot that polls the backend and runs one job at a time.
 *
 * <p>Use {@link #processOne()} to drive it synchronously, or {@link #start()} to poll on a
 * background thread. After an empty poll the wait doubles from the poll interval up to the
 * maximum idle interval and resets once a job is found.
 */
public class QueueWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final String workerId;
    private final QueueBackend backend;
    private final QueueCtx ctx;
    private final JobRunner runner;
    private final WorkerConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    private volatile SlotState state = SlotState.IDLE;
    private Thread workerThread;

    public QueueWorker(QueueBackend backend, QueueCtx ctx, JobRunner runner, WorkerConfig config) {
        this(config.getWorkerId(), backend, ctx, runner, config);
    }

    QueueWorker(String workerId, QueueBackend backend, QueueCtx ctx, JobRunner runner, WorkerConfig config) {
        this.workerId = workerId;
        this.backend = backend;
        this.ctx = ctx;
        this.runner = runner;
        this.config = config;
    }

    /**
     * Start the worker in the background.
     */
    public void start() {
        if (shutdown.get()) {
            throw new IllegalStateException("Worker " + workerId + " was stopped and cannot be restarted");
        }
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "leaseq-worker-" + workerId);
            workerThread.setDaemon(true);
            workerThread.start();
            log.info("Worker started workerId={} queues={}", workerId, config.getQueues());
        }
    }

    /**
     * Stop polling and wait up to the shutdown grace period for the job in flight.
     */
    public void stop() {
        shutdown.set(true);
        running.set(false);
        stopSignal.countDown();
        if (workerThread != null) {
            try {
                workerThread.join(config.getShutdownGrace().toMillis());
                if (workerThread.isAlive()) {
                    log.warn("Worker {} still busy after {}, interrupting", workerId, config.getShutdownGrace());
                    workerThread.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            workerThread = null;
        }
        state = SlotState.STOPPED;
        log.info("Worker stopped workerId={} processed={} failed={}", workerId, processedCount.get(), failedCount.get());
    }

    /**
     * Poll once and run at most one job.
     *
     * @return true if a job was leased
     * @throws QueueException WORKER_SHUTDOWN once the worker has been stopped
     */
    public boolean processOne() throws QueueException {
        return pollOnce().isPresent();
    }

    /**
     * Poll once and run at most one job, returning its result.
     */
    public Optional<JobRunner.Result> pollOnce() throws QueueException {
        if (shutdown.get()) {
            throw QueueException.workerShutdown(workerId);
        }
        state = SlotState.POLLING;
        Optional<LeasedJob> leased;
        try {
            leased = backend.dequeue(ctx, config.getQueues());
        } finally {
            state = SlotState.IDLE;
        }
        if (leased.isEmpty()) {
            return Optional.empty();
        }

        state = SlotState.EXECUTING;
        try {
            JobRunner.Result result = runner.run(leased.get(), () -> state = SlotState.ACKING);
            if (result.getOutcome().isError()) {
                failedCount.incrementAndGet();
            } else {
                processedCount.incrementAndGet();
            }
            return Optional.of(result);
        } finally {
            state = SlotState.IDLE;
        }
    }

    private void run() {
        Duration idle = config.getPollInterval();
        while (running.get()) {
            try {
                if (processOne()) {
                    idle = config.getPollInterval();
                    continue;
                }
                if (await(idle)) {
                    break;
                }
                idle = nextIdle(idle, config.getMaxIdleInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (QueueException e) {
                if (e.is(QueueErrorKind.WORKER_SHUTDOWN)) {
                    break;
                }
                log.error("Worker {} poll failed: {}", workerId, e.getMessage(), e);
                if (awaitQuietly(config.getMaxIdleInterval())) {
                    break;
                }
            } catch (RuntimeException e) {
                log.error("Worker {} loop error", workerId, e);
                if (awaitQuietly(config.getMaxIdleInterval())) {
                    break;
                }
            }
        }
    }

    /**
     * Wait for {@code duration} or until stopped.
     *
     * @return true if the worker was stopped
     */
    boolean await(Duration duration) throws InterruptedException {
        return stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean awaitQuietly(Duration duration) {
        try {
            return await(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    static Duration nextIdle(Duration current, Duration max) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(max) > 0 ? max : doubled;
    }

    public String getWorkerId() { return workerId; }
    public SlotState getState() { return state; }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get(); }

    void markParked() {
        state = SlotState.PARKED;
    }

    @Override
    public void close() {
        stop();
    }
}
