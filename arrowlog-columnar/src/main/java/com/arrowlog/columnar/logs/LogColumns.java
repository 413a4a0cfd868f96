package com.arrowlog.columnar.logs;

/** Column names of the primary log table. */
public final class LogColumns {
    public static final String TIME_UNIX_NANO = "time_unix_nano";
    public static final String OBSERVED_TIME_UNIX_NANO = "observed_time_unix_nano";
    public static final String SEVERITY_NUMBER = "severity_number";
    public static final String SEVERITY_TEXT = "severity_text";
    public static final String BODY = "body";
    public static final String BODY_STR = "str";
    public static final String TRACE_ID = "trace_id";
    public static final String SPAN_ID = "span_id";
    public static final String FLAGS = "flags";
    public static final String EVENT_NAME = "event_name";
    public static final String RESOURCE = "resource";
    public static final String RESOURCE_ID = "id";

    private LogColumns() {}
}
