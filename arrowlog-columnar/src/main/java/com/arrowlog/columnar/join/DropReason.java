package com.arrowlog.columnar.join;

/** Why an attribute row did not end up on any log record. */
public enum DropReason {
    NULL_PARENT,
    UNRESOLVED_KEY,
    /** Type tag without a supported value variant. */
    UNSUPPORTED_TYPE,
    MISSING_VALUE,
    /** Parent id past the last row of the primary table. */
    PARENT_OUT_OF_RANGE
}
