package com.arrowlog.exporter.node;

/** The message channel was closed while a receive or send was pending. */
public class ChannelClosedException extends IllegalStateException {

    public ChannelClosedException(String message) {
        super(message);
    }
}
