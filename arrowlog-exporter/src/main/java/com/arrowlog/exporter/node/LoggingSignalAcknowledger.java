package com.arrowlog.exporter.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Acknowledger for hosts without upstream delivery tracking: acks at DEBUG, nacks at WARN. */
public final class LoggingSignalAcknowledger implements SignalAcknowledger {
    private static final Logger log = LoggerFactory.getLogger(LoggingSignalAcknowledger.class);

    @Override
    public void ack(Signal signal) {
        if (log.isDebugEnabled()) {
            log.debug("ack signal id={}, type={}", signal.id(), signal.type());
        }
    }

    @Override
    public void nack(Signal signal, ExportFailure failure) {
        log.warn(
                "nack signal id={}, type={}, stage={}, reason={}",
                signal.id(),
                signal.type(),
                failure.stage(),
                failure.message());
    }
}
