package com.arrowlog.logs.model;

import java.util.Objects;

public record LogAttribute(String key, AttributeValue value) {
    public LogAttribute {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static LogAttribute of(String key, String value) {
        return new LogAttribute(key, AttributeValue.of(value));
    }

    public static LogAttribute of(String key, long value) {
        return new LogAttribute(key, AttributeValue.of(value));
    }
}
