package com.arrowlog.testkit;

import com.arrowlog.columnar.ColumnarBatch;
import com.arrowlog.columnar.ColumnarTable;
import com.arrowlog.columnar.PayloadType;
import com.arrowlog.columnar.join.AttributeColumns;
import com.arrowlog.columnar.logs.LogColumns;
import com.arrowlog.logs.model.AttributeType;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampNanoVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * Row-oriented builder for columnar log batches, laid out the way an upstream columnar receiver delivers them:
 * dictionary-encoded strings, a {@code body} struct, a {@code resource} struct carrying the resource id and separate
 * log and resource attribute tables joined by {@code parent_id}.
 *
 * <pre>{@code
 * ColumnarBatch batch = new LogsBatchBuilder(allocator)
 *         .log(row -> row.time(1_000L).severity(9, "INFO").body("started").resource(1).attribute("user.id", "u-1"))
 *         .resourceAttribute(1, "service.name", "checkout")
 *         .build();
 * }</pre>
 *
 * The returned batch owns its vectors; the caller closes it.
 */
public final class LogsBatchBuilder {

    private static final ArrowType.Int KEY_TYPE = new ArrowType.Int(16, false);

    private final BufferAllocator allocator;
    private final List<Row> rows = new ArrayList<>();
    private final List<AttributeRow> logAttributes = new ArrayList<>();
    private final List<AttributeRow> resourceAttributes = new ArrayList<>();
    private long nextDictionaryId;

    public LogsBatchBuilder(BufferAllocator allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    public LogsBatchBuilder log(Consumer<Row> row) {
        Row r = new Row(rows.size());
        row.accept(r);
        rows.add(r);
        return this;
    }

    /** {@code count} rows carrying only a timestamp and the given event name. */
    public LogsBatchBuilder logs(int count, String eventName) {
        for (int i = 0; i < count; i++) {
            long time = rows.size() + 1L;
            log(row -> row.time(time).eventName(eventName));
        }
        return this;
    }

    public LogsBatchBuilder resourceAttribute(int resourceId, String key, String value) {
        resourceAttributes.add(new AttributeRow(resourceId, key, AttributeType.STRING.tag(), value, null));
        return this;
    }

    public LogsBatchBuilder resourceAttribute(int resourceId, String key, long value) {
        resourceAttributes.add(new AttributeRow(resourceId, key, AttributeType.INT.tag(), null, value));
        return this;
    }

    /** Raw log attribute row, for parent ids or type tags a well-formed producer would not emit. */
    public LogsBatchBuilder rawLogAttribute(Integer parentId, String key, int typeTag, String str, Long integer) {
        logAttributes.add(new AttributeRow(parentId, key, typeTag, str, integer));
        return this;
    }

    public ColumnarBatch build() {
        List<AttributeRow> allLogAttributes = new ArrayList<>();
        rows.forEach(row -> allLogAttributes.addAll(row.attributes));
        allLogAttributes.addAll(logAttributes);

        ColumnarBatch.Builder batch = ColumnarBatch.builder().table(PayloadType.LOGS, logsTable());
        if (!allLogAttributes.isEmpty()) batch.table(PayloadType.LOG_ATTRS, attributeTable(allLogAttributes));
        if (!resourceAttributes.isEmpty()) batch.table(PayloadType.RESOURCE_ATTRS, attributeTable(resourceAttributes));
        return batch.build();
    }

    private ColumnarTable logsTable() {
        int n = rows.size();
        DictionaryBuilder severityText = new DictionaryBuilder();
        DictionaryBuilder bodies = new DictionaryBuilder();
        DictionaryBuilder eventNames = new DictionaryBuilder();

        TimeStampNanoVector time = new TimeStampNanoVector(LogColumns.TIME_UNIX_NANO, allocator);
        TimeStampNanoVector observed = new TimeStampNanoVector(LogColumns.OBSERVED_TIME_UNIX_NANO, allocator);
        IntVector severityNumber = new IntVector(LogColumns.SEVERITY_NUMBER, allocator);
        UInt2Vector severityKeys = severityText.keyVector(LogColumns.SEVERITY_TEXT);
        StructVector body = StructVector.empty(LogColumns.BODY, allocator);
        UInt2Vector bodyKeys = body.addOrGet(LogColumns.BODY_STR, bodies.keyFieldType(), UInt2Vector.class);
        VarBinaryVector traceId = new VarBinaryVector(LogColumns.TRACE_ID, allocator);
        VarBinaryVector spanId = new VarBinaryVector(LogColumns.SPAN_ID, allocator);
        UInt4Vector flags = new UInt4Vector(LogColumns.FLAGS, allocator);
        UInt2Vector eventKeys = eventNames.keyVector(LogColumns.EVENT_NAME);
        StructVector resource = StructVector.empty(LogColumns.RESOURCE, allocator);
        UInt2Vector resourceId =
                resource.addOrGet(LogColumns.RESOURCE_ID, FieldType.nullable(KEY_TYPE), UInt2Vector.class);

        List<FieldVector> vectors = List.of(
                time, observed, severityNumber, severityKeys, body, traceId, spanId, flags, eventKeys, resource);
        vectors.forEach(FieldVector::allocateNew);

        for (int i = 0; i < n; i++) {
            Row row = rows.get(i);
            setLong(time, i, row.time);
            setLong(observed, i, row.observedTime);
            if (row.severityNumber == null) severityNumber.setNull(i);
            else severityNumber.setSafe(i, row.severityNumber);
            severityText.set(severityKeys, i, row.severityText);
            if (row.body == null) {
                body.setNull(i);
                bodyKeys.setNull(i);
            } else {
                body.setIndexDefined(i);
                bodies.set(bodyKeys, i, row.body);
            }
            setBytes(traceId, i, row.traceId);
            setBytes(spanId, i, row.spanId);
            if (row.flags == null) flags.setNull(i);
            else flags.setSafe(i, (int) (long) row.flags);
            eventNames.set(eventKeys, i, row.eventName);
            resource.setIndexDefined(i);
            if (row.resourceId == null) resourceId.setNull(i);
            else resourceId.setSafe(i, row.resourceId);
        }
        return table(vectors, n, severityText.build(), bodies.build(), eventNames.build());
    }

    private ColumnarTable attributeTable(List<AttributeRow> attributes) {
        int n = attributes.size();
        DictionaryBuilder keys = new DictionaryBuilder();
        DictionaryBuilder strings = new DictionaryBuilder();

        UInt2Vector parentId = new UInt2Vector(AttributeColumns.PARENT_ID, allocator);
        UInt2Vector keyVector = keys.keyVector(AttributeColumns.KEY);
        UInt1Vector type = new UInt1Vector(AttributeColumns.TYPE, allocator);
        UInt2Vector str = strings.keyVector(AttributeColumns.STR);
        BigIntVector integer = new BigIntVector(AttributeColumns.INT, allocator);

        List<FieldVector> vectors = List.of(parentId, keyVector, type, str, integer);
        vectors.forEach(FieldVector::allocateNew);

        for (int i = 0; i < n; i++) {
            AttributeRow row = attributes.get(i);
            if (row.parentId == null) parentId.setNull(i);
            else parentId.setSafe(i, row.parentId);
            keys.set(keyVector, i, row.key);
            type.setSafe(i, row.typeTag);
            strings.set(str, i, row.str);
            setLong(integer, i, row.integer);
        }
        return table(vectors, n, keys.build(), strings.build());
    }

    private static ColumnarTable table(List<FieldVector> vectors, int rowCount, Dictionary... dictionaries) {
        VectorSchemaRoot root = new VectorSchemaRoot(vectors);
        root.setRowCount(rowCount);
        return new ColumnarTable(root, new DictionaryProvider.MapDictionaryProvider(dictionaries));
    }

    private static void setLong(TimeStampNanoVector vector, int index, Long value) {
        if (value == null) vector.setNull(index);
        else vector.setSafe(index, value);
    }

    private static void setLong(BigIntVector vector, int index, Long value) {
        if (value == null) vector.setNull(index);
        else vector.setSafe(index, value);
    }

    private static void setBytes(VarBinaryVector vector, int index, byte[] value) {
        if (value == null) vector.setNull(index);
        else vector.setSafe(index, value);
    }

    /** Distinct strings in first-seen order, and the {@code uint16} key vectors that point into them. */
    private final class DictionaryBuilder {
        private final long id = nextDictionaryId++;
        private final Map<String, Integer> keys = new LinkedHashMap<>();

        FieldType keyFieldType() {
            return new FieldType(true, KEY_TYPE, new DictionaryEncoding(id, false, KEY_TYPE));
        }

        UInt2Vector keyVector(String name) {
            return new UInt2Vector(name, keyFieldType(), allocator);
        }

        void set(UInt2Vector vector, int index, String value) {
            if (value == null) {
                vector.setNull(index);
                return;
            }
            vector.setSafe(index, keys.computeIfAbsent(value, v -> keys.size()));
        }

        Dictionary build() {
            VarCharVector values = new VarCharVector("dictionary-" + id, allocator);
            values.allocateNew();
            int i = 0;
            for (String value : keys.keySet()) {
                values.setSafe(i++, value.getBytes(StandardCharsets.UTF_8));
            }
            values.setValueCount(keys.size());
            return new Dictionary(values, new DictionaryEncoding(id, false, KEY_TYPE));
        }
    }

    private record AttributeRow(Integer parentId, String key, int typeTag, String str, Long integer) {}

    /** One primary-table row. Unset fields are written as null cells. */
    public static final class Row {
        private final int index;
        private Long time;
        private Long observedTime;
        private Integer severityNumber;
        private String severityText;
        private String body;
        private byte[] traceId;
        private byte[] spanId;
        private Long flags;
        private String eventName;
        private Integer resourceId;
        private final List<AttributeRow> attributes = new ArrayList<>();

        private Row(int index) {
            this.index = index;
        }

        public int index() {
            return index;
        }

        public Row time(long unixNanos) {
            this.time = unixNanos;
            return this;
        }

        public Row observedTime(long unixNanos) {
            this.observedTime = unixNanos;
            return this;
        }

        public Row severity(int number, String text) {
            this.severityNumber = number;
            this.severityText = text;
            return this;
        }

        public Row severityNumber(int number) {
            this.severityNumber = number;
            return this;
        }

        public Row body(String body) {
            this.body = body;
            return this;
        }

        public Row traceId(byte[] traceId) {
            this.traceId = traceId;
            return this;
        }

        public Row spanId(byte[] spanId) {
            this.spanId = spanId;
            return this;
        }

        public Row flags(long flags) {
            this.flags = flags;
            return this;
        }

        public Row eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Row resource(int resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Row attribute(String key, String value) {
            attributes.add(new AttributeRow(index, key, AttributeType.STRING.tag(), value, null));
            return this;
        }

        public Row attribute(String key, long value) {
            attributes.add(new AttributeRow(index, key, AttributeType.INT.tag(), null, value));
            return this;
        }
    }
}
