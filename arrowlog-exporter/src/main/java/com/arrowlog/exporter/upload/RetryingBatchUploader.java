package com.arrowlog.exporter.upload;

import com.arrowlog.transport.BatchUploader;
import com.arrowlog.transport.EncodedBatch;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one batch through up to {@link RetryPolicy#maxAttempts()} upload attempts with capped exponential backoff.
 *
 * <p>Waits are scheduled through the {@link RetryScheduler}; no thread sleeps between attempts. The returned future
 * completes normally on the first successful attempt, or exceptionally with the last {@link IOException} once the
 * attempts are used up. Unchecked exceptions from the uploader are not retried.
 */
@Slf4j
public final class RetryingBatchUploader {

    private final BatchUploader uploader;
    private final RetryPolicy policy;
    private final RetryScheduler scheduler;
    private final RetryListener listener;

    public RetryingBatchUploader(BatchUploader uploader, RetryPolicy policy, RetryScheduler scheduler) {
        this(uploader, policy, scheduler, RetryListener.NONE);
    }

    public RetryingBatchUploader(
            BatchUploader uploader, RetryPolicy policy, RetryScheduler scheduler, RetryListener listener) {
        this.uploader = Objects.requireNonNull(uploader, "uploader");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.listener = listener != null ? listener : RetryListener.NONE;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public CompletableFuture<Void> upload(EncodedBatch batch) {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("Refusing to upload empty batch " + batch.eventName());
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt(batch, 1, policy.initialInterval(), result);
        return result;
    }

    /**
     * Runs attempts on the calling thread while waits are already complete, so zero or elapsed delays never deepen
     * the stack. Only a pending wait hands the remaining attempts to its completion.
     */
    private void attempt(EncodedBatch batch, int first, Duration firstDelay, CompletableFuture<Void> result) {
        int attempt = first;
        Duration delay = firstDelay;
        while (true) {
            IOException failure;
            try {
                uploader.upload(batch);
                if (attempt > 1 && log.isDebugEnabled()) {
                    log.debug("Upload of {} succeeded on attempt {}", batch, attempt);
                }
                result.complete(null);
                return;
            } catch (IOException ex) {
                failure = ex;
            } catch (RuntimeException ex) {
                log.error("Uploader failed unexpectedly on {}", batch, ex);
                result.completeExceptionally(ex);
                return;
            }

            int maxAttempts = policy.maxAttempts();
            if (attempt >= maxAttempts) {
                if (maxAttempts > 1) {
                    log.warn("Upload of {} failed after {} attempts: {}", batch, attempt, failure.getMessage());
                }
                result.completeExceptionally(failure);
                return;
            }
            log.warn(
                    "Upload of {} failed: {}. Retrying attempt {}/{} after {} ms",
                    batch,
                    failure.getMessage(),
                    attempt + 1,
                    maxAttempts,
                    delay.toMillis());
            notifyRetry(batch, attempt, maxAttempts, delay, failure);

            CompletableFuture<Void> wait;
            try {
                wait = scheduler.after(delay);
            } catch (RuntimeException ex) {
                log.error("Could not schedule backoff for {}, giving up after attempt {}", batch, attempt, ex);
                result.completeExceptionally(failure);
                return;
            }
            int next = attempt + 1;
            Duration nextDelay = policy.nextDelay(delay);
            if (wait.isDone() && !wait.isCompletedExceptionally()) {
                attempt = next;
                delay = nextDelay;
                continue;
            }
            int failedAttempt = attempt;
            IOException lastFailure = failure;
            wait.whenComplete((ignored, waitFailure) -> {
                if (waitFailure != null) {
                    log.error(
                            "Backoff wait for {} failed, giving up after attempt {}", batch, failedAttempt, waitFailure);
                    result.completeExceptionally(lastFailure);
                    return;
                }
                attempt(batch, next, nextDelay, result);
            });
            return;
        }
    }

    private void notifyRetry(EncodedBatch batch, int attempt, int maxAttempts, Duration delay, IOException error) {
        try {
            listener.onRetry(batch, attempt, maxAttempts, delay, error);
        } catch (RuntimeException ex) {
            log.warn("Retry listener failed for {}", batch, ex);
        }
    }
}
