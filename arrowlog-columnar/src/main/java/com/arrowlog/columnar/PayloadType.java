package com.arrowlog.columnar;

/** Tables that may travel together in one columnar log batch. */
public enum PayloadType {
    /** Primary table, one row per log record. */
    LOGS,
    /** Per-record attributes; {@code parent_id} is the row index in {@link #LOGS}. */
    LOG_ATTRS,
    /** Per-resource attributes; {@code parent_id} is the resource surrogate id. */
    RESOURCE_ATTRS
}
