package com.arrowlog.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Minimal transport SPI: deliver one encoded log batch to the ingestion endpoint.
 *
 * <p>Implementations make a single attempt per call; retries are layered on top by the exporter.
 */
public interface BatchUploader extends Closeable {

    void upload(EncodedBatch batch) throws IOException;

    @Override
    default void close() throws IOException {
        /* no-op */
    }
}
