package com.arrowlog.exporter.upload;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/** Completes a future once a backoff delay has elapsed, without parking the calling thread. */
@FunctionalInterface
public interface RetryScheduler {

    CompletableFuture<Void> after(Duration delay);

    /** Delays run off a shared timer and resume on {@code executor}. */
    static RetryScheduler on(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return delay -> {
            if (delay.isZero() || delay.isNegative()) return CompletableFuture.completedFuture(null);
            Executor delayed = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor);
            return CompletableFuture.runAsync(() -> {}, delayed);
        };
    }
}
