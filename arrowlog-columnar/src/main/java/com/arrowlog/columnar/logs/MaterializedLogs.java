package com.arrowlog.columnar.logs;

import com.arrowlog.logs.model.LogRecord;
import java.util.List;

public record MaterializedLogs(List<LogRecord> records, DecodeStats stats) {
    public MaterializedLogs {
        records = List.copyOf(records);
    }
}
