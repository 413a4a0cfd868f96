package com.arrowlog.columnar.access;

@FunctionalInterface
public interface ColumnIssueListener {

    ColumnIssueListener NONE = issue -> {};

    void onIssue(ColumnIssue issue);
}
