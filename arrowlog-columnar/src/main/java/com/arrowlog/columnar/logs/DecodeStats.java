package com.arrowlog.columnar.logs;

import com.arrowlog.columnar.access.ColumnIssue;
import com.arrowlog.columnar.join.DropReason;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * What one materialization pass saw: rows decoded, attributes attached from each attribute table, attribute rows
 * dropped by reason and columns that could not be read.
 */
public record DecodeStats(
        int rows,
        int logAttributes,
        int resourceAttributes,
        Map<DropReason, Integer> dropped,
        List<ColumnIssue> columnIssues) {

    public DecodeStats {
        EnumMap<DropReason, Integer> copy = new EnumMap<>(DropReason.class);
        if (dropped != null) copy.putAll(dropped);
        dropped = Collections.unmodifiableMap(copy);
        columnIssues = columnIssues != null ? List.copyOf(columnIssues) : List.of();
    }

    public int dropped(DropReason reason) {
        return dropped.getOrDefault(reason, 0);
    }

    public int droppedAttributes() {
        return dropped.values().stream().mapToInt(Integer::intValue).sum();
    }

    public String summary() {
        return "rows=" + rows
                + ", logAttributes=" + logAttributes
                + ", resourceAttributes=" + resourceAttributes
                + ", dropped=" + dropped
                + ", columnIssues=" + columnIssues;
    }
}
