package com.umitunal.leaseq.worker;

import com.umitunal.leaseq.config.AdaptiveConfig;
import com.umitunal.leaseq.config.WorkerConfig;
import com.umitunal.leaseq.core.QueueBackend;
import com.umitunal.leaseq.core.QueueCtx;
import com.umitunal.leaseq.core.QueueException;
import com.umitunal.leaseq.job.JobRegistry;
import com.umitunal.leaseq.serialization.CodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs up to {@code maxConcurrency} worker slots and lets a {@link ConcurrencyController} decide
 * how many of them poll. Slots above the current limit park until the limit grows again.
 *
 * <p>Every adjust interval the executor samples the eligible depth of its queues and the recent
 * outcome window, then asks the controller for a new limit.
 */
public class AdaptiveExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveExecutor.class);

    private final QueueBackend backend;
    private final QueueCtx ctx;
    private final JobRegistry registry;
    private final CodecRegistry codecs;
    private final WorkerConfig workerConfig;
    private final AdaptiveConfig adaptiveConfig;
    private final ConcurrencyController controller;
    private final OutcomeWindow window;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<QueueWorker> slots = new ArrayList<>();

    private JobRunner runner;
    private ExecutorService slotPool;
    private ScheduledExecutorService adjuster;
    private CountDownLatch stopSignal;

    public AdaptiveExecutor(QueueBackend backend, QueueCtx ctx, JobRegistry registry, CodecRegistry codecs,
                            WorkerConfig workerConfig, AdaptiveConfig adaptiveConfig) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.codecs = Objects.requireNonNull(codecs, "codecs must not be null");
        this.workerConfig = Objects.requireNonNull(workerConfig, "workerConfig must not be null");
        this.adaptiveConfig = Objects.requireNonNull(adaptiveConfig, "adaptiveConfig must not be null");
        this.controller = new ConcurrencyController(adaptiveConfig);
        this.window = new OutcomeWindow(adaptiveConfig.getWindowSize());
    }

    /**
     * Start the slots and the adjustment tick. Calling it again has no effect.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        running.set(true);
        stopSignal = new CountDownLatch(1);
        runner = new JobRunner(backend, ctx, registry, codecs, workerConfig);

        int max = adaptiveConfig.getMaxConcurrency();
        AtomicInteger threadIds = new AtomicInteger(0);
        slotPool = Executors.newFixedThreadPool(max, r -> {
            Thread t = new Thread(r);
            t.setName("leaseq-slot-" + workerConfig.getWorkerId() + "-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < max; i++) {
            QueueWorker slot = new QueueWorker(workerConfig.getWorkerId() + "-" + i, backend, ctx, runner, workerConfig);
            slots.add(slot);
            int index = i;
            slotPool.submit(() -> slotLoop(index, slot));
        }

        adjuster = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("leaseq-adjuster-" + workerConfig.getWorkerId());
            t.setDaemon(true);
            return t;
        });
        long interval = adaptiveConfig.getAdjustInterval().toMillis();
        adjuster.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MILLISECONDS);

        log.info("Adaptive executor started workerId={} queues={} concurrency={} bounds=[{}, {}]",
                workerConfig.getWorkerId(), workerConfig.getQueues(), controller.current(),
                adaptiveConfig.getMinConcurrency(), max);
    }

    /**
     * Stop polling and wait up to the shutdown grace period for running jobs. Calling it again has no effect.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Adaptive executor stopping workerId={}", workerConfig.getWorkerId());
        stopSignal.countDown();
        adjuster.shutdownNow();

        slotPool.shutdown();
        try {
            if (!slotPool.awaitTermination(workerConfig.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Slots still busy after {}, interrupting", workerConfig.getShutdownGrace());
                slotPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            slotPool.shutdownNow();
        }
        slots.forEach(QueueWorker::stop);
        runner.close();
        log.info("Adaptive executor stopped workerId={}", workerConfig.getWorkerId());
    }

    private void slotLoop(int index, QueueWorker slot) {
        Duration idle = workerConfig.getPollInterval();
        while (running.get()) {
            try {
                if (index >= controller.current()) {
                    slot.markParked();
                    if (awaitStop(workerConfig.getPollInterval())) {
                        return;
                    }
                    continue;
                }
                Optional<JobRunner.Result> result = slot.pollOnce();
                if (result.isPresent()) {
                    JobRunner.Result r = result.get();
                    if (r.getOutcome() != JobRunner.Outcome.DISCARDED) {
                        window.record(r.getLatency(), r.getOutcome().isError());
                    }
                    idle = workerConfig.getPollInterval();
                    continue;
                }
                if (awaitStop(idle)) {
                    return;
                }
                idle = QueueWorker.nextIdle(idle, workerConfig.getMaxIdleInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (QueueException e) {
                log.error("Slot {} poll failed: {}", index, e.getMessage(), e);
                if (awaitStopQuietly(workerConfig.getMaxIdleInterval())) {
                    return;
                }
            } catch (RuntimeException e) {
                log.error("Slot {} loop error", index, e);
                if (awaitStopQuietly(workerConfig.getMaxIdleInterval())) {
                    return;
                }
            }
        }
    }

    /**
     * One adjustment round: sample depth and outcomes, then resize.
     */
    void tick() {
        try {
            long depth = backend.metrics(ctx, workerConfig.getQueues()).getEligibleDepth();
            ConcurrencyController.Signals signals =
                    new ConcurrencyController.Signals(depth, window.averageLatency(), window.errorRate());
            log.debug("Adjusting concurrency {}", signals);
            controller.adjust(signals);
        } catch (QueueException | RuntimeException e) {
            log.warn("Concurrency adjustment failed: {}", e.getMessage(), e);
        }
    }

    private boolean awaitStop(Duration duration) throws InterruptedException {
        return stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean awaitStopQuietly(Duration duration) {
        try {
            return awaitStop(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    public int currentConcurrency() {
        return controller.current();
    }

    public ConcurrencyController getController() { return controller; }
    public OutcomeWindow getWindow() { return window; }
    public boolean isRunning() { return running.get(); }

    /**
     * State of every slot, by index.
     */
    public synchronized List<SlotState> slotStates() {
        List<SlotState> states = new ArrayList<>(slots.size());
        for (QueueWorker slot : slots) {
            states.add(slot.getState());
        }
        return states;
    }

    @Override
    public void close() {
        stop();
    }
}
