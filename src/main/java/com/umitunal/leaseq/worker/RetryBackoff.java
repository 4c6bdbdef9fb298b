package com.umitunal.leaseq.worker;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential retry delay with jitter:
 * {@code delay(n) = min(cap, base * multiplier^(n-1) * (1 + j))}, j uniform in [0, jitterRatio).
 *
 * <p>Requiring {@code multiplier >= 1 + jitterRatio} keeps the delay non-decreasing in n
 * whatever jitter is drawn.
 */
public class RetryBackoff {
    private final Duration base;
    private final double multiplier;
    private final Duration cap;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public RetryBackoff(Duration base, double multiplier, Duration cap, double jitterRatio) {
        this(base, multiplier, cap, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1)
     */
    public RetryBackoff(Duration base, double multiplier, Duration cap, double jitterRatio, DoubleSupplier random) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.cap = Objects.requireNonNull(cap, "cap must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must not be below base");
        }
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1)");
        }
        if (multiplier < 1 + jitterRatio) {
            throw new IllegalArgumentException("multiplier must be at least 1 + jitterRatio");
        }
        this.multiplier = multiplier;
        this.jitterRatio = jitterRatio;
    }

    /**
     * 1s base, doubling, capped at one hour, 10% jitter.
     */
    public static RetryBackoff defaults() {
        return new RetryBackoff(Duration.ofSeconds(1), 2.0, Duration.ofHours(1), 0.1);
    }

    public static RetryBackoff fixedExponential(Duration base, double multiplier, Duration cap) {
        return new RetryBackoff(base, multiplier, cap, 0.0);
    }

    /**
     * Delay before the attempt following attempt number {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        int n = Math.max(1, attempt);
        double jitter = jitterRatio == 0 ? 0 : random.getAsDouble() * jitterRatio;
        double millis = base.toMillis() * Math.pow(multiplier, n - 1) * (1 + jitter);
        if (millis >= cap.toMillis()) {
            return cap;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * When to retry after attempt {@code attempt} failed, or empty once the retries are used up.
     */
    public Optional<Instant> retryAt(int attempt, int maxRetries, Instant now) {
        if (attempt > maxRetries) {
            return Optional.empty();
        }
        return Optional.of(now.plus(delayFor(attempt)));
    }

    public Duration getBase() { return base; }
    public double getMultiplier() { return multiplier; }
    public Duration getCap() { return cap; }
    public double getJitterRatio() { return jitterRatio; }

    @Override
    public String toString() {
        return String.format("RetryBackoff{base=%s, multiplier=%.2f, cap=%s, jitter=%.2f}",
                base, multiplier, cap, jitterRatio);
    }
}
