package com.arrowlog.exporter.node;

import com.arrowlog.columnar.ColumnarBatch;
import com.arrowlog.columnar.logs.LogRecordMaterializer;
import com.arrowlog.columnar.logs.MaterializedLogs;
import com.arrowlog.exporter.config.ExporterConfig;
import com.arrowlog.exporter.encode.EncodeException;
import com.arrowlog.exporter.encode.JsonLinesLogBatchEncoder;
import com.arrowlog.exporter.encode.LogBatchEncoder;
import com.arrowlog.exporter.metrics.ExporterMetrics;
import com.arrowlog.exporter.metrics.MetricsSnapshot;
import com.arrowlog.exporter.upload.RetryPolicy;
import com.arrowlog.exporter.upload.RetryScheduler;
import com.arrowlog.exporter.upload.RetryingBatchUploader;
import com.arrowlog.logs.model.LogRecord;
import com.arrowlog.logs.model.SignalType;
import com.arrowlog.transport.BatchUploader;
import com.arrowlog.transport.EncodedBatch;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Exporter node: consumes {@link ExporterMessage}s from a {@link MessageChannel} one at a time on a dedicated worker
 * thread and turns every log signal into uploaded batches plus exactly one ack or nack.
 *
 * <p>Lifecycle is {@code RUNNING -> DRAINING -> STOPPED}. A {@link ExporterMessage.Shutdown} is only looked at once
 * the previous message has been fully handled, so a signal in the middle of its upload retries is always resolved
 * first. Signals still queued at that point are nacked with {@link ExportFailure.Stage#SHUTDOWN}. The future returned
 * by {@link #start(MessageChannel)} completes with the {@link TerminalState}, or exceptionally if the channel is
 * closed without a shutdown.
 */
@Slf4j
public final class LogExporter implements AutoCloseable {

    public enum State {
        RUNNING,
        DRAINING,
        STOPPED
    }

    private final String name;
    private final LogRecordMaterializer materializer;
    private final LogBatchEncoder encoder;
    private final BatchUploader uploader;
    private final RetryingBatchUploader retrying;
    private final SignalAcknowledger acknowledger;
    private final ExporterMetrics metrics;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<TerminalState> terminal = new CompletableFuture<>();
    private volatile State state = State.RUNNING;
    private MessageChannel channel;

    private LogExporter(Builder b) {
        this.name = b.name;
        this.materializer = b.materializer != null ? b.materializer : new LogRecordMaterializer();
        this.encoder = Objects.requireNonNull(b.encoder, "encoder");
        this.uploader = Objects.requireNonNull(b.uploader, "uploader");
        this.acknowledger = b.acknowledger != null ? b.acknowledger : new LoggingSignalAcknowledger();
        this.metrics = b.metrics != null ? b.metrics : new ExporterMetrics();
        this.ownsExecutor = b.executor == null;
        this.executor = ownsExecutor ? newWorker(name) : b.executor;
        RetryScheduler scheduler = b.scheduler != null ? b.scheduler : RetryScheduler.on(executor);
        RetryPolicy policy = b.retryPolicy != null ? b.retryPolicy : RetryPolicy.defaults();
        this.retrying = new RetryingBatchUploader(
                uploader, policy, scheduler, (batch, attempt, max, delay, error) -> metrics.uploadRetried());
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public State state() {
        return state;
    }

    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    /** Begins consuming {@code channel}. May be called once. */
    public CompletableFuture<TerminalState> start(MessageChannel channel) {
        Objects.requireNonNull(channel, "channel");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Exporter " + name + " already started");
        }
        this.channel = channel;
        log.info("Exporter {} started, retry policy {}", name, retrying.policy());
        executor.execute(this::receiveNext);
        return terminal;
    }

    private void receiveNext() {
        channel.receive().whenCompleteAsync(this::onMessage, executor);
    }

    private void onMessage(ExporterMessage message, Throwable receiveFailure) {
        if (receiveFailure != null) {
            Throwable cause = unwrap(receiveFailure);
            state = State.STOPPED;
            log.error("Exporter {} lost its channel without a shutdown: {}", name, cause.getMessage());
            terminal.completeExceptionally(cause);
            return;
        }
        try {
            if (message instanceof ExporterMessage.Data data) {
                export(data.signal()).whenCompleteAsync((ignored, failure) -> {
                    if (failure != null) {
                        log.error("Exporter {} failed handling {}", name, data.signal(), unwrap(failure));
                    }
                    receiveNext();
                }, executor);
            } else if (message instanceof ExporterMessage.CollectTelemetry collect) {
                report(collect.reporter());
                receiveNext();
            } else if (message instanceof ExporterMessage.Shutdown shutdown) {
                shutdown(shutdown);
            }
        } catch (RuntimeException ex) {
            log.error("Exporter {} failed handling message {}", name, message, ex);
            receiveNext();
        }
    }

    private CompletableFuture<Void> export(Signal signal) {
        metrics.signalConsumed(signal.type());
        if (signal.type() != SignalType.LOGS) {
            release(signal);
            fail(signal, ExportFailure.of(ExportFailure.Stage.UNSUPPORTED, signal.type() + " signals are not supported"));
            return CompletableFuture.completedFuture(null);
        }

        List<LogRecord> records;
        try (ColumnarBatch payload = signal.payload()) {
            MaterializedLogs logs = materializer.materialize(payload);
            metrics.attributesDropped(logs.stats().droppedAttributes());
            records = logs.records();
        } catch (RuntimeException ex) {
            fail(signal, new ExportFailure(ExportFailure.Stage.DECODE, describe(ex), ex));
            return CompletableFuture.completedFuture(null);
        }

        List<EncodedBatch> batches;
        try {
            batches = encoder.encode(records);
        } catch (EncodeException | RuntimeException ex) {
            fail(signal, new ExportFailure(ExportFailure.Stage.ENCODE, describe(ex), ex));
            return CompletableFuture.completedFuture(null);
        }

        int total = batches.size();
        FirstFailure firstFailure = new FirstFailure();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < total; i++) {
            EncodedBatch batch = batches.get(i);
            int number = i + 1;
            chain = chain.thenCompose(ignored -> upload(batch, number, total, firstFailure));
        }
        return chain.thenRun(() -> {
            if (firstFailure.error == null) {
                succeed(signal);
                return;
            }
            String message = "batch " + firstFailure.number + "/" + total + " failed: " + describe(firstFailure.error);
            fail(signal, new ExportFailure(ExportFailure.Stage.UPLOAD, message, firstFailure.error));
        });
    }

    private CompletableFuture<Void> upload(EncodedBatch batch, int number, int total, FirstFailure firstFailure) {
        if (batch.isEmpty()) {
            metrics.batchSkippedEmpty();
            log.debug("Skipping empty batch {}/{} ({})", number, total, batch.eventName());
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> attempt;
        try {
            attempt = retrying.upload(batch);
        } catch (RuntimeException ex) {
            attempt = CompletableFuture.failedFuture(ex);
        }
        return attempt.<Void>handle((ignored, failure) -> {
            if (failure == null) {
                metrics.batchUploaded();
            } else {
                metrics.batchFailed();
                Throwable cause = unwrap(failure);
                log.warn("Batch {}/{} ({}) failed: {}", number, total, batch, cause.getMessage());
                if (firstFailure.error == null) {
                    firstFailure.number = number;
                    firstFailure.error = cause;
                }
            }
            return null;
        });
    }

    private void shutdown(ExporterMessage.Shutdown shutdown) {
        state = State.DRAINING;
        log.info("Exporter {} draining: {}", name, shutdown.reason());
        channel.close();
        for (ExporterMessage pending : channel.drain()) {
            if (pending instanceof ExporterMessage.Data data) {
                Signal signal = data.signal();
                metrics.signalConsumed(signal.type());
                release(signal);
                fail(signal, ExportFailure.of(ExportFailure.Stage.SHUTDOWN, "exporter shutting down: " + shutdown.reason()));
            } else if (pending instanceof ExporterMessage.CollectTelemetry collect) {
                report(collect.reporter());
            }
        }
        if (Instant.now().isAfter(shutdown.deadline())) {
            log.warn("Exporter {} stopped after its shutdown deadline {}", name, shutdown.deadline());
        }
        state = State.STOPPED;
        MetricsSnapshot finalMetrics = metrics.snapshot();
        log.info("Exporter {} stopped: {}", name, finalMetrics);
        terminal.complete(new TerminalState(shutdown.deadline(), shutdown.reason(), finalMetrics));
    }

    private void succeed(Signal signal) {
        metrics.signalExported(signal.type());
        try {
            acknowledger.ack(signal);
        } catch (RuntimeException ex) {
            log.warn("Acknowledger failed to ack {}", signal, ex);
        }
    }

    private void fail(Signal signal, ExportFailure failure) {
        metrics.signalFailed(signal.type());
        try {
            acknowledger.nack(signal, failure);
        } catch (RuntimeException ex) {
            log.warn("Acknowledger failed to nack {} ({})", signal, failure, ex);
        }
    }

    private void report(MetricsReporter reporter) {
        try {
            reporter.report(metrics.snapshot());
        } catch (RuntimeException ex) {
            log.warn("Metrics reporter failed on exporter {}", name, ex);
        }
    }

    private void release(Signal signal) {
        try {
            signal.payload().close();
        } catch (RuntimeException ex) {
            log.warn("Failed to release payload of {}", signal, ex);
        }
    }

    /** Fails the start future if no shutdown was honored, stops the worker and closes the uploader. */
    @Override
    public void close() {
        if (state != State.STOPPED) {
            state = State.STOPPED;
            terminal.completeExceptionally(new IllegalStateException("Exporter " + name + " closed before shutdown"));
        }
        if (channel != null) channel.close();
        if (ownsExecutor) executor.shutdownNow();
        try {
            uploader.close();
        } catch (IOException ex) {
            log.warn("Failed to close uploader of exporter {}", name, ex);
        }
    }

    private static ExecutorService newWorker(String name) {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "arrowlog-exporter-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class FirstFailure {
        private int number;
        private Throwable error;
    }

    public static final class Builder {
        private String name = "default";
        private LogRecordMaterializer materializer;
        private LogBatchEncoder encoder;
        private BatchUploader uploader;
        private RetryPolicy retryPolicy;
        private SignalAcknowledger acknowledger;
        private ExporterMetrics metrics;
        private ExecutorService executor;
        private RetryScheduler scheduler;

        private Builder() {}

        /** Validates {@code config} and derives the encoder and retry policy from it. */
        public Builder config(ExporterConfig config) {
            config.validate();
            this.encoder = new JsonLinesLogBatchEncoder(config.maxRecordsPerBatch(), config.commonFields());
            this.retryPolicy = config.batchRetry();
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder materializer(LogRecordMaterializer materializer) {
            this.materializer = materializer;
            return this;
        }

        public Builder encoder(LogBatchEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder uploader(BatchUploader uploader) {
            this.uploader = uploader;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder acknowledger(SignalAcknowledger acknowledger) {
            this.acknowledger = acknowledger;
            return this;
        }

        public Builder metrics(ExporterMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Single-threaded executor to run on instead of a dedicated worker thread. Not shut down by the exporter. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder retryScheduler(RetryScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public LogExporter build() {
            return new LogExporter(this);
        }
    }
}
