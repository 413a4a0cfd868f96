package com.arrowlog.exporter.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class MessageChannelTest {

    private final MessageChannel channel = new MessageChannel();

    @Test
    void deliversInSendOrder() {
        ExporterMessage first = new ExporterMessage.Shutdown(Instant.EPOCH, "first");
        ExporterMessage second = new ExporterMessage.Shutdown(Instant.EPOCH, "second");
        channel.send(first);
        channel.send(second);

        assertThat(channel.receive()).isCompletedWithValue(first);
        assertThat(channel.receive()).isCompletedWithValue(second);
    }

    @Test
    void pendingReceiverCompletesOnSend() {
        CompletableFuture<ExporterMessage> next = channel.receive();
        assertThat(next).isNotDone();

        ExporterMessage message = new ExporterMessage.Shutdown(Instant.EPOCH, null);
        channel.send(message);

        assertThat(next).isCompletedWithValue(message);
        assertThat(channel.drain()).isEmpty();
    }

    @Test
    void closeFailsPendingReceiversButKeepsQueuedMessages() {
        CompletableFuture<ExporterMessage> pending = channel.receive();
        channel.close();

        assertThatThrownBy(pending::get).isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ChannelClosedException.class);

        MessageChannel other = new MessageChannel();
        ExporterMessage queued = new ExporterMessage.Shutdown(Instant.EPOCH, "queued");
        other.send(queued);
        other.close();
        assertThat(other.receive()).isCompletedWithValue(queued);
        assertThat(other.receive()).isCompletedExceptionally();
    }

    @Test
    void sendAfterCloseIsRejected() {
        channel.close();

        assertThat(channel.isClosed()).isTrue();
        assertThatThrownBy(() -> channel.send(new ExporterMessage.Shutdown(Instant.EPOCH, "late")))
                .isInstanceOf(ChannelClosedException.class);
    }

    @Test
    void drainEmptiesTheQueue() {
        channel.send(new ExporterMessage.Shutdown(Instant.EPOCH, "a"));
        channel.send(new ExporterMessage.Shutdown(Instant.EPOCH, "b"));

        assertThat(channel.drain()).hasSize(2);
        assertThat(channel.drain()).isEmpty();
        assertThat(channel.receive()).isNotDone();
    }
}
