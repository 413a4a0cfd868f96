package com.arrowlog.columnar.access;

import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.IntPredicate;

/** Bounds and parent-null handling shared by every column kind; the reader only sees valid rows. */
final class VectorColumn<T> implements Column<T> {

    private final String name;
    private final int rowCount;
    private final IntPredicate parentNull;
    private final IntFunction<Optional<T>> reader;

    VectorColumn(String name, int rowCount, IntPredicate parentNull, IntFunction<Optional<T>> reader) {
        this.name = name;
        this.rowCount = rowCount;
        this.parentNull = parentNull;
        this.reader = reader;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public Optional<T> valueAt(int row) {
        if (row < 0 || row >= rowCount || parentNull.test(row)) return Optional.empty();
        return reader.apply(row);
    }

    @Override
    public String toString() {
        return "Column[" + name + ", rows=" + rowCount + "]";
    }
}
