package com.arrowlog.exporter.node;

import java.util.Objects;

/** Why a signal was negatively acknowledged. */
public record ExportFailure(Stage stage, String message, Throwable cause) {

    public enum Stage {
        UNSUPPORTED,
        DECODE,
        ENCODE,
        UPLOAD,
        SHUTDOWN
    }

    public ExportFailure {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(message, "message");
    }

    public static ExportFailure of(Stage stage, String message) {
        return new ExportFailure(stage, message, null);
    }

    @Override
    public String toString() {
        return stage + ": " + message;
    }
}
