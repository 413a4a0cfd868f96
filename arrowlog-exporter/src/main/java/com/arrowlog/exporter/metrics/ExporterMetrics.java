package com.arrowlog.exporter.metrics;

import com.arrowlog.logs.model.SignalType;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counters of one exporter node. Written from the node's worker thread, read from anywhere through
 * {@link #snapshot()}.
 */
public final class ExporterMetrics {

    private final Map<SignalType, AtomicLong> consumed = counters();
    private final Map<SignalType, AtomicLong> exported = counters();
    private final Map<SignalType, AtomicLong> failed = counters();
    private final AtomicLong batchesUploaded = new AtomicLong();
    private final AtomicLong batchesFailed = new AtomicLong();
    private final AtomicLong batchesSkippedEmpty = new AtomicLong();
    private final AtomicLong uploadRetries = new AtomicLong();
    private final AtomicLong droppedAttributes = new AtomicLong();

    public void signalConsumed(SignalType type) {
        consumed.get(type).incrementAndGet();
    }

    public void signalExported(SignalType type) {
        exported.get(type).incrementAndGet();
    }

    public void signalFailed(SignalType type) {
        failed.get(type).incrementAndGet();
    }

    public void batchUploaded() {
        batchesUploaded.incrementAndGet();
    }

    public void batchFailed() {
        batchesFailed.incrementAndGet();
    }

    public void batchSkippedEmpty() {
        batchesSkippedEmpty.incrementAndGet();
    }

    public void uploadRetried() {
        uploadRetries.incrementAndGet();
    }

    public void attributesDropped(long count) {
        if (count > 0) droppedAttributes.addAndGet(count);
    }

    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                values(consumed),
                values(exported),
                values(failed),
                batchesUploaded.get(),
                batchesFailed.get(),
                batchesSkippedEmpty.get(),
                uploadRetries.get(),
                droppedAttributes.get());
    }

    private static Map<SignalType, AtomicLong> counters() {
        Map<SignalType, AtomicLong> map = new EnumMap<>(SignalType.class);
        for (SignalType type : SignalType.values()) {
            map.put(type, new AtomicLong());
        }
        return map;
    }

    private static Map<SignalType, Long> values(Map<SignalType, AtomicLong> counters) {
        Map<SignalType, Long> map = new EnumMap<>(SignalType.class);
        counters.forEach((type, counter) -> map.put(type, counter.get()));
        return map;
    }
}
