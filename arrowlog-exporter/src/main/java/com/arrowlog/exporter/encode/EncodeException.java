package com.arrowlog.exporter.encode;

/** Records could not be turned into upload batches. */
public class EncodeException extends Exception {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
