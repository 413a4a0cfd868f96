package com.arrowlog.exporter.metrics;

import com.arrowlog.logs.model.SignalType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Point-in-time copy of {@link ExporterMetrics}. */
public record MetricsSnapshot(
        Map<SignalType, Long> consumed,
        Map<SignalType, Long> exported,
        Map<SignalType, Long> failed,
        long batchesUploaded,
        long batchesFailed,
        long batchesSkippedEmpty,
        long uploadRetries,
        long droppedAttributes) {

    public MetricsSnapshot {
        consumed = copy(consumed);
        exported = copy(exported);
        failed = copy(failed);
    }

    public long consumed(SignalType type) {
        return consumed.getOrDefault(type, 0L);
    }

    public long exported(SignalType type) {
        return exported.getOrDefault(type, 0L);
    }

    public long failed(SignalType type) {
        return failed.getOrDefault(type, 0L);
    }

    private static Map<SignalType, Long> copy(Map<SignalType, Long> source) {
        Map<SignalType, Long> map = new EnumMap<>(SignalType.class);
        if (source != null) map.putAll(source);
        return Collections.unmodifiableMap(map);
    }
}
