package com.arrowlog.testkit;

import com.arrowlog.transport.BatchUploader;
import com.arrowlog.transport.EncodedBatch;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/** Test double that records batches in memory and can be told to fail. */
public class InMemoryBatchUploader implements BatchUploader {
    private final List<EncodedBatch> uploaded = Collections.synchronizedList(new ArrayList<>());
    private final List<EncodedBatch> attempted = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private volatile Predicate<EncodedBatch> alwaysFail = batch -> false;
    private volatile boolean closed;

    @Override
    public void upload(EncodedBatch batch) throws IOException {
        attempted.add(batch);
        if (alwaysFail.test(batch)) {
            throw new IOException("HTTP 503 - rejected " + batch.eventName());
        }
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IOException("HTTP 503 - transient failure");
        }
        uploaded.add(batch);
    }

    /** The next {@code times} attempts fail, whatever the batch. */
    public InMemoryBatchUploader failNext(int times) {
        pendingFailures.set(times);
        return this;
    }

    /** Every attempt with a matching batch fails. */
    public InMemoryBatchUploader failWhen(Predicate<EncodedBatch> condition) {
        alwaysFail = condition != null ? condition : batch -> false;
        return this;
    }

    public List<EncodedBatch> uploaded() {
        synchronized (uploaded) {
            return List.copyOf(uploaded);
        }
    }

    public List<EncodedBatch> attempted() {
        synchronized (attempted) {
            return List.copyOf(attempted);
        }
    }

    public int attempts() {
        return attempted.size();
    }

    public boolean isClosed() {
        return closed;
    }

    public void clear() {
        uploaded.clear();
        attempted.clear();
        pendingFailures.set(0);
        alwaysFail = batch -> false;
    }

    @Override
    public void close() {
        closed = true;
    }
}
