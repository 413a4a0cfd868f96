package com.arrowlog.logs.model;

import java.util.Optional;

/** Type tags of columnar attribute rows that map onto {@link AttributeValue}. */
public enum AttributeType {
    STRING(1),
    INT(2);

    private final int tag;

    AttributeType(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    /** Empty for tags without a supported value variant (double, bool, map, slice, bytes, ...). */
    public static Optional<AttributeType> fromTag(long tag) {
        for (AttributeType t : values()) {
            if (t.tag == tag) return Optional.of(t);
        }
        return Optional.empty();
    }
}
