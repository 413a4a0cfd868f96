package com.arrowlog.exporter.node;

import com.arrowlog.columnar.ColumnarBatch;
import com.arrowlog.logs.model.SignalType;
import java.util.Objects;

/**
 * One inbound telemetry signal. The exporter takes ownership of the payload and closes it once decoded or rejected.
 */
public record Signal(String id, SignalType type, ColumnarBatch payload) {

    public Signal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (payload == null) payload = ColumnarBatch.empty();
    }

    public static Signal logs(String id, ColumnarBatch payload) {
        return new Signal(id, SignalType.LOGS, payload);
    }

    @Override
    public String toString() {
        return "Signal{id=" + id + ", type=" + type + '}';
    }
}
