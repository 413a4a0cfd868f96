package com.arrowlog.columnar.access;

/**
 * A column that could not be read as requested. The affected field degrades to absent; decoding continues.
 */
public record ColumnIssue(String column, Kind kind, String detail) {

    public enum Kind {
        MISSING,
        UNEXPECTED_TYPE,
        MISSING_DICTIONARY
    }

    @Override
    public String toString() {
        return column + ": " + kind + (detail == null || detail.isBlank() ? "" : " (" + detail + ")");
    }
}
