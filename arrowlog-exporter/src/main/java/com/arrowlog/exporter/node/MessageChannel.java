package com.arrowlog.exporter.node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Unbounded FIFO between a host and one exporter node. Receivers get a future instead of blocking; futures are
 * completed outside the channel lock so their continuations never run while it is held.
 */
public final class MessageChannel implements AutoCloseable {

    private final Deque<ExporterMessage> queue = new ArrayDeque<>();
    private final Deque<CompletableFuture<ExporterMessage>> receivers = new ArrayDeque<>();
    private boolean closed;

    /** @throws ChannelClosedException when the channel has been closed */
    public void send(ExporterMessage message) {
        Objects.requireNonNull(message, "message");
        CompletableFuture<ExporterMessage> receiver;
        synchronized (this) {
            if (closed) throw new ChannelClosedException("Channel closed, dropping " + describe(message));
            receiver = receivers.poll();
            if (receiver == null) {
                queue.add(message);
                return;
            }
        }
        receiver.complete(message);
    }

    /** Next message; fails with {@link ChannelClosedException} once the channel is closed and empty. */
    public CompletableFuture<ExporterMessage> receive() {
        synchronized (this) {
            ExporterMessage next = queue.poll();
            if (next != null) return CompletableFuture.completedFuture(next);
            if (closed) return CompletableFuture.failedFuture(new ChannelClosedException("Channel closed"));
            CompletableFuture<ExporterMessage> receiver = new CompletableFuture<>();
            receivers.add(receiver);
            return receiver;
        }
    }

    /** Removes and returns every queued message. */
    public List<ExporterMessage> drain() {
        synchronized (this) {
            List<ExporterMessage> drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Stops accepting messages. Queued messages stay receivable; pending receivers fail. */
    @Override
    public void close() {
        List<CompletableFuture<ExporterMessage>> pending;
        synchronized (this) {
            if (closed) return;
            closed = true;
            pending = new ArrayList<>(receivers);
            receivers.clear();
        }
        pending.forEach(r -> r.completeExceptionally(new ChannelClosedException("Channel closed")));
    }

    private static String describe(ExporterMessage message) {
        if (message instanceof ExporterMessage.Data data) return data.signal().toString();
        return message.getClass().getSimpleName();
    }
}
