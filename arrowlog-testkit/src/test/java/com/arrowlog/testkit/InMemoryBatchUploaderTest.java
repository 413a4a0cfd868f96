package com.arrowlog.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arrowlog.transport.EncodedBatch;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class InMemoryBatchUploaderTest {

    private static EncodedBatch batch(String event) {
        return new EncodedBatch(event, new byte[] {1}, 1, "application/x-ndjson", null);
    }

    @Test
    void scriptedFailuresPrecedeSuccess() throws IOException {
        InMemoryBatchUploader uploader = new InMemoryBatchUploader().failNext(1);

        assertThatThrownBy(() -> uploader.upload(batch("Log"))).isInstanceOf(IOException.class);
        uploader.upload(batch("Log"));

        assertThat(uploader.attempts()).isEqualTo(2);
        assertThat(uploader.uploaded()).hasSize(1);
    }

    @Test
    void conditionalFailureOnlyHitsMatchingBatches() throws IOException {
        InMemoryBatchUploader uploader = new InMemoryBatchUploader().failWhen(b -> b.eventName().equals("Audit"));

        uploader.upload(batch("Log"));
        assertThatThrownBy(() -> uploader.upload(batch("Audit"))).hasMessageContaining("Audit");

        assertThat(uploader.uploaded()).extracting(EncodedBatch::eventName).containsExactly("Log");
    }
}
