package com.arrowlog.logs.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Typed attribute value. Only string and signed 64-bit integer values are carried; columnar attribute rows of any
 * other type are dropped before they reach this model.
 */
public sealed interface AttributeValue permits AttributeValue.StringValue, AttributeValue.IntValue {

    static AttributeValue of(String value) {
        return new StringValue(value);
    }

    static AttributeValue of(long value) {
        return new IntValue(value);
    }

    AttributeType type();

    /** Plain Java value, used for JSON output. */
    @JsonValue
    Object raw();

    record StringValue(String value) implements AttributeValue {
        public StringValue {
            if (value == null) throw new IllegalArgumentException("value");
        }

        @Override
        public AttributeType type() {
            return AttributeType.STRING;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record IntValue(long value) implements AttributeValue {
        @Override
        public AttributeType type() {
            return AttributeType.INT;
        }

        @Override
        public Object raw() {
            return value;
        }
    }
}
