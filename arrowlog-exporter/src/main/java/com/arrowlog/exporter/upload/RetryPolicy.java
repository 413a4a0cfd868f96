package com.arrowlog.exporter.upload;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential backoff between upload attempts.
 *
 * @param maxRetries retries after the first attempt
 * @param initialInterval wait before the first retry
 * @param maxInterval upper bound on any wait, {@link Duration#ZERO} for no bound
 * @param multiplier growth factor applied after every retry
 * @param enabled {@code false} makes every batch a single attempt
 */
public record RetryPolicy(
        int maxRetries, Duration initialInterval, Duration maxInterval, double multiplier, boolean enabled) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(5);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    public RetryPolicy {
        Objects.requireNonNull(initialInterval, "initialInterval");
        Objects.requireNonNull(maxInterval, "maxInterval");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (initialInterval.isNegative()) throw new IllegalArgumentException("initialInterval must be >= 0");
        if (maxInterval.isNegative()) throw new IllegalArgumentException("maxInterval must be >= 0");
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(
                DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_INTERVAL, DEFAULT_MAX_INTERVAL, DEFAULT_MULTIPLIER, true);
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(0, DEFAULT_INITIAL_INTERVAL, DEFAULT_MAX_INTERVAL, DEFAULT_MULTIPLIER, false);
    }

    /** Total attempts per batch, the first one included. */
    public int maxAttempts() {
        return enabled ? 1 + maxRetries : 1;
    }

    /** Wait that follows {@code current}: grown by the multiplier and capped at {@link #maxInterval()}. */
    public Duration nextDelay(Duration current) {
        double grown = current.toNanos() * multiplier;
        long nanos = grown >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) grown;
        Duration next = Duration.ofNanos(nanos);
        if (maxInterval.isZero() || next.compareTo(maxInterval) <= 0) return next;
        return maxInterval;
    }
}
