package com.arrowlog.exporter.config;

/** Exporter configuration is missing a required value or holds an invalid one. */
public class ExporterConfigException extends IllegalArgumentException {
    private final String field;

    public ExporterConfigException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
