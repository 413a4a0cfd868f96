package com.arrowlog.columnar.logs;

import com.arrowlog.columnar.PayloadType;

/** The batch has no table of the type decoding starts from. */
public class MissingPayloadException extends IllegalArgumentException {
    private final PayloadType payloadType;

    public MissingPayloadException(PayloadType payloadType) {
        super("No " + payloadType + " table in columnar batch");
        this.payloadType = payloadType;
    }

    public PayloadType payloadType() {
        return payloadType;
    }
}
