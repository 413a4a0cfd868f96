package com.arrowlog.columnar.logs;

import com.arrowlog.columnar.ColumnarBatch;
import com.arrowlog.columnar.ColumnarTable;
import com.arrowlog.columnar.PayloadType;
import com.arrowlog.columnar.access.Column;
import com.arrowlog.columnar.access.ColumnAccessor;
import com.arrowlog.columnar.access.ColumnIssue;
import com.arrowlog.columnar.access.ColumnIssueListener;
import com.arrowlog.columnar.join.AttributeColumns;
import com.arrowlog.columnar.join.AttributeIndex;
import com.arrowlog.columnar.join.AttributeJoiner;
import com.arrowlog.columnar.join.DropReason;
import com.arrowlog.logs.model.LogAttribute;
import com.arrowlog.logs.model.LogBody;
import com.arrowlog.logs.model.LogRecord;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a columnar log batch into one {@link LogRecord} per primary-table row, in row order.
 *
 * <p>Scalar fields come from the {@code LOGS} table. Log attributes are joined on row index, then resource attributes
 * on the row's {@code resource.id}; a record's own attributes always precede its resource's. Missing attribute tables
 * and unreadable columns only leave fields empty. The only hard failure is a batch without a {@code LOGS} table.
 */
public final class LogRecordMaterializer {
    private static final Logger log = LoggerFactory.getLogger(LogRecordMaterializer.class);

    private final AttributeJoiner joiner;

    public LogRecordMaterializer() {
        this(new AttributeJoiner());
    }

    public LogRecordMaterializer(AttributeJoiner joiner) {
        this.joiner = Objects.requireNonNull(joiner, "joiner");
    }

    public MaterializedLogs materialize(ColumnarBatch batch) {
        ColumnarTable logs = batch.get(PayloadType.LOGS).orElseThrow(() -> new MissingPayloadException(PayloadType.LOGS));

        List<ColumnIssue> issues = new ArrayList<>();
        ColumnIssueListener listener = issues::add;
        ColumnAccessor columns = ColumnAccessor.of(logs, listener);
        int rows = columns.rowCount();

        List<LogRecord.Builder> builders = readScalars(columns);
        Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);

        int logAttributes = 0;
        Optional<ColumnarTable> logAttrs = batch.get(PayloadType.LOG_ATTRS);
        if (logAttrs.isPresent()) {
            AttributeIndex index = joiner.buildParentIndex(logAttrs.get(), AttributeColumns.PARENT_ID, listener);
            merge(dropped, index.stats().dropped());
            for (Map.Entry<Long, List<LogAttribute>> entry : index.byParent().entrySet()) {
                long parent = entry.getKey();
                List<LogAttribute> attrs = entry.getValue();
                // uint64 ids above Long.MAX_VALUE read back negative
                if (parent < 0 || parent >= rows) {
                    dropped.merge(DropReason.PARENT_OUT_OF_RANGE, attrs.size(), Integer::sum);
                    continue;
                }
                builders.get((int) parent).addAttributes(attrs);
                logAttributes += attrs.size();
            }
        }

        int resourceAttributes = 0;
        Optional<ColumnarTable> resourceAttrs = batch.get(PayloadType.RESOURCE_ATTRS);
        if (resourceAttrs.isPresent()) {
            Optional<Column<Long>> resourceIds =
                    columns.nested(LogColumns.RESOURCE).flatMap(r -> r.unsigned(LogColumns.RESOURCE_ID));
            AttributeIndex index = joiner.buildParentIndex(resourceAttrs.get(), AttributeColumns.PARENT_ID, listener);
            merge(dropped, index.stats().dropped());
            for (int row = 0; row < rows; row++) {
                Optional<Long> resourceId = read(resourceIds, row);
                if (resourceId.isEmpty()) continue;
                List<LogAttribute> attrs = index.attributesOf(resourceId.get());
                builders.get(row).addAttributes(attrs);
                resourceAttributes += attrs.size();
            }
        }

        List<LogRecord> records = new ArrayList<>(rows);
        for (LogRecord.Builder builder : builders) {
            records.add(builder.build());
        }
        DecodeStats stats = new DecodeStats(rows, logAttributes, resourceAttributes, dropped, issues);
        if (log.isDebugEnabled()) {
            log.debug("Materialized columnar log batch: {}", stats.summary());
        }
        return new MaterializedLogs(records, stats);
    }

    private static List<LogRecord.Builder> readScalars(ColumnAccessor columns) {
        Optional<Column<Long>> time = columns.timestampNanos(LogColumns.TIME_UNIX_NANO);
        Optional<Column<Long>> observed = columns.timestampNanos(LogColumns.OBSERVED_TIME_UNIX_NANO);
        Optional<Column<Long>> severityNumber = columns.ints(LogColumns.SEVERITY_NUMBER);
        Optional<Column<String>> severityText = columns.strings(LogColumns.SEVERITY_TEXT);
        Optional<Column<String>> body = columns.nested(LogColumns.BODY).flatMap(b -> b.strings(LogColumns.BODY_STR));
        Optional<Column<byte[]>> traceId = columns.binary(LogColumns.TRACE_ID);
        Optional<Column<byte[]>> spanId = columns.binary(LogColumns.SPAN_ID);
        Optional<Column<Long>> flags = columns.unsigned(LogColumns.FLAGS);
        Optional<Column<String>> eventName = columns.strings(LogColumns.EVENT_NAME);

        int rows = columns.rowCount();
        List<LogRecord.Builder> builders = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            builders.add(LogRecord.builder()
                    .timeUnixNano(read(time, row).orElse(null))
                    .observedTimeUnixNano(read(observed, row).orElse(null))
                    .severityNumber(read(severityNumber, row).map(Long::intValue).orElse(null))
                    .severityText(read(severityText, row).orElse(null))
                    .body(read(body, row).map(LogBody::of).orElse(null))
                    .traceId(read(traceId, row).orElse(null))
                    .spanId(read(spanId, row).orElse(null))
                    .flags(read(flags, row).orElse(null))
                    .eventName(read(eventName, row).orElse(null)));
        }
        return builders;
    }

    private static <T> Optional<T> read(Optional<Column<T>> column, int row) {
        return column.flatMap(c -> c.valueAt(row));
    }

    private static void merge(Map<DropReason, Integer> into, Map<DropReason, Integer> from) {
        from.forEach((reason, count) -> into.merge(reason, count, Integer::sum));
    }
}
