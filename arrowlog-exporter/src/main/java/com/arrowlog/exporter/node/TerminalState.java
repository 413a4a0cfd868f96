package com.arrowlog.exporter.node;

import com.arrowlog.exporter.metrics.MetricsSnapshot;
import java.time.Instant;

/** How an exporter node stopped: the shutdown it honored and its final counters. */
public record TerminalState(Instant deadline, String reason, MetricsSnapshot metrics) {}
