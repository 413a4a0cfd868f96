package com.arrowlog.columnar.join;

/** Column names shared by the log, resource and scope attribute tables. */
public final class AttributeColumns {
    public static final String PARENT_ID = "parent_id";
    public static final String KEY = "key";
    public static final String TYPE = "type";
    public static final String STR = "str";
    public static final String INT = "int";

    private AttributeColumns() {}
}
