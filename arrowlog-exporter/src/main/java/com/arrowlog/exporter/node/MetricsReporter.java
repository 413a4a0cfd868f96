package com.arrowlog.exporter.node;

import com.arrowlog.exporter.metrics.MetricsSnapshot;

@FunctionalInterface
public interface MetricsReporter {

    void report(MetricsSnapshot snapshot);
}
