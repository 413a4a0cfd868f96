package com.arrowlog.exporter.node;

import java.time.Instant;
import java.util.Objects;

/** What an exporter node can receive from its host. */
public sealed interface ExporterMessage
        permits ExporterMessage.Data, ExporterMessage.CollectTelemetry, ExporterMessage.Shutdown {

    record Data(Signal signal) implements ExporterMessage {
        public Data {
            Objects.requireNonNull(signal, "signal");
        }
    }

    record CollectTelemetry(MetricsReporter reporter) implements ExporterMessage {
        public CollectTelemetry {
            Objects.requireNonNull(reporter, "reporter");
        }
    }

    record Shutdown(Instant deadline, String reason) implements ExporterMessage {
        public Shutdown {
            Objects.requireNonNull(deadline, "deadline");
            if (reason == null) reason = "";
        }
    }
}
