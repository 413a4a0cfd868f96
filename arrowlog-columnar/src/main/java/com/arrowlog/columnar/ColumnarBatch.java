package com.arrowlog.columnar;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The tables of one inbound log signal keyed by {@link PayloadType}. Closing the batch closes every table.
 */
public final class ColumnarBatch implements AutoCloseable {

    private final Map<PayloadType, ColumnarTable> tables;

    private ColumnarBatch(Map<PayloadType, ColumnarTable> tables) {
        this.tables = tables;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ColumnarBatch empty() {
        return new ColumnarBatch(new EnumMap<>(PayloadType.class));
    }

    public Optional<ColumnarTable> get(PayloadType type) {
        return Optional.ofNullable(tables.get(type));
    }

    /** Row count of the given table, 0 when it is absent. */
    public int rowCount(PayloadType type) {
        ColumnarTable table = tables.get(type);
        return table != null ? table.rowCount() : 0;
    }

    @Override
    public void close() {
        RuntimeException failure = null;
        for (ColumnarTable table : tables.values()) {
            try {
                table.close();
            } catch (RuntimeException ex) {
                if (failure == null) failure = ex;
                else failure.addSuppressed(ex);
            }
        }
        tables.clear();
        if (failure != null) throw failure;
    }

    public static final class Builder {
        private final Map<PayloadType, ColumnarTable> tables = new EnumMap<>(PayloadType.class);

        private Builder() {}

        public Builder table(PayloadType type, ColumnarTable table) {
            if (type != null && table != null) tables.put(type, table);
            return this;
        }

        public ColumnarBatch build() {
            return new ColumnarBatch(tables);
        }
    }
}
