package com.arrowlog.exporter.node;

/**
 * Host-side acknowledgement boundary. The exporter calls exactly one of the two methods for every data signal it
 * receives.
 */
public interface SignalAcknowledger {

    void ack(Signal signal);

    void nack(Signal signal, ExportFailure failure);
}
