package com.arrowlog.exporter.spring;

import com.arrowlog.exporter.node.ChannelClosedException;
import com.arrowlog.exporter.node.ExporterMessage;
import com.arrowlog.exporter.node.LogExporter;
import com.arrowlog.exporter.node.MessageChannel;
import com.arrowlog.exporter.node.TerminalState;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Runs a {@link LogExporter} for the lifetime of the application context. Stopping sends a
 * {@link ExporterMessage.Shutdown} and waits up to the shutdown timeout for the exporter to drain.
 */
@Slf4j
public class ExporterLifecycle implements SmartLifecycle {

    private final LogExporter exporter;
    private final MessageChannel channel;
    private final Duration shutdownTimeout;
    private volatile CompletableFuture<TerminalState> terminal;
    private volatile boolean running;

    public ExporterLifecycle(LogExporter exporter, MessageChannel channel, Duration shutdownTimeout) {
        this.exporter = exporter;
        this.channel = channel;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        terminal = exporter.start(channel);
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        try {
            channel.send(new ExporterMessage.Shutdown(Instant.now().plus(shutdownTimeout), "application context stopping"));
            TerminalState state = terminal.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Exporter {} drained: {}", exporter.name(), state.metrics());
        } catch (ChannelClosedException e) {
            log.warn("Exporter {} channel already closed: {}", exporter.name(), e.getMessage());
        } catch (TimeoutException e) {
            log.warn("Exporter {} did not drain within {}", exporter.name(), shutdownTimeout);
        } catch (ExecutionException e) {
            log.warn("Exporter {} stopped abnormally", exporter.name(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping exporter {}", exporter.name());
        } finally {
            exporter.close();
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Completes once the exporter has stopped; {@code null} before {@link #start()}. */
    public CompletableFuture<TerminalState> terminal() {
        return terminal;
    }
}
