package com.arrowlog.logs.model;

/** Kind of telemetry carried by an inbound signal. */
public enum SignalType {
    LOGS,
    TRACES,
    METRICS
}
