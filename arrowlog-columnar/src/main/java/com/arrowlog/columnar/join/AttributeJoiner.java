package com.arrowlog.columnar.join;

import com.arrowlog.columnar.ColumnarTable;
import com.arrowlog.columnar.access.Column;
import com.arrowlog.columnar.access.ColumnAccessor;
import com.arrowlog.columnar.access.ColumnIssueListener;
import com.arrowlog.logs.model.AttributeType;
import com.arrowlog.logs.model.AttributeValue;
import com.arrowlog.logs.model.LogAttribute;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups the rows of an attribute table by parent id in one linear scan.
 *
 * <p>The same scan serves log attributes (parent id is a row index of the primary table) and resource attributes
 * (parent id is a resource surrogate id); callers only choose which column carries the parent id. Rows with a null
 * parent, an unresolvable key, an unsupported type tag or a missing value are skipped and counted in
 * {@link JoinStats}.
 */
public final class AttributeJoiner {

    public AttributeIndex buildParentIndex(ColumnarTable table, String parentIdColumn) {
        return buildParentIndex(table, parentIdColumn, ColumnIssueListener.NONE);
    }

    public AttributeIndex buildParentIndex(ColumnarTable table, String parentIdColumn, ColumnIssueListener issues) {
        ColumnAccessor columns = ColumnAccessor.of(table, issues);
        Optional<Column<Long>> parents = columns.unsigned(parentIdColumn);
        Optional<Column<String>> keys = columns.strings(AttributeColumns.KEY);
        Optional<Column<Long>> types = columns.unsigned(AttributeColumns.TYPE);
        ValueColumns values = new ValueColumns(columns);

        Map<Long, List<LogAttribute>> index = new LinkedHashMap<>();
        Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);
        int indexed = 0;
        int rows = columns.rowCount();
        for (int row = 0; row < rows; row++) {
            Optional<Long> parent = read(parents, row);
            if (parent.isEmpty()) {
                dropped.merge(DropReason.NULL_PARENT, 1, Integer::sum);
                continue;
            }
            Optional<String> key = read(keys, row);
            if (key.isEmpty()) {
                dropped.merge(DropReason.UNRESOLVED_KEY, 1, Integer::sum);
                continue;
            }
            Optional<AttributeType> type = read(types, row).flatMap(AttributeType::fromTag);
            if (type.isEmpty()) {
                dropped.merge(DropReason.UNSUPPORTED_TYPE, 1, Integer::sum);
                continue;
            }
            Optional<AttributeValue> value = values.read(type.get(), row);
            if (value.isEmpty()) {
                dropped.merge(DropReason.MISSING_VALUE, 1, Integer::sum);
                continue;
            }
            index.computeIfAbsent(parent.get(), p -> new ArrayList<>())
                    .add(new LogAttribute(key.get(), value.get()));
            indexed++;
        }
        return new AttributeIndex(index, new JoinStats(rows, indexed, dropped));
    }

    private static <T> Optional<T> read(Optional<Column<T>> column, int row) {
        return column.flatMap(c -> c.valueAt(row));
    }

    /** Value columns are looked up on first use so a table without int attributes does not report a missing column. */
    private static final class ValueColumns {
        private final ColumnAccessor columns;
        private Optional<Column<String>> strings;
        private Optional<Column<Long>> ints;

        ValueColumns(ColumnAccessor columns) {
            this.columns = columns;
        }

        Optional<AttributeValue> read(AttributeType type, int row) {
            switch (type) {
                case STRING:
                    if (strings == null) strings = columns.strings(AttributeColumns.STR);
                    return AttributeJoiner.read(strings, row).map(AttributeValue::of);
                case INT:
                    if (ints == null) ints = columns.ints(AttributeColumns.INT);
                    return AttributeJoiner.read(ints, row).map(v -> AttributeValue.of(v.longValue()));
                default:
                    return Optional.empty();
            }
        }
    }
}
