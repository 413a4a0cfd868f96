package com.arrowlog.exporter.upload;

import com.arrowlog.transport.EncodedBatch;
import java.time.Duration;

@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (batch, failedAttempt, maxAttempts, delay, error) -> {};

    /** Attempt {@code failedAttempt} of {@code maxAttempts} failed; the next one starts after {@code delay}. */
    void onRetry(EncodedBatch batch, int failedAttempt, int maxAttempts, Duration delay, Exception error);
}
