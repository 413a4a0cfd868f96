package com.arrowlog.columnar.access;

import java.util.Optional;

/**
 * Typed, null-aware view of one column.
 *
 * @param <T> decoded cell type
 */
public interface Column<T> {

    /** Dotted path of the column, e.g. {@code body.str}. */
    String name();

    int rowCount();

    /**
     * Cell value at {@code row}. Empty when the cell is null, when a dictionary key is null or outside its
     * dictionary, when an enclosing struct cell is null, or when {@code row} is outside {@code [0, rowCount)}.
     */
    Optional<T> valueAt(int row);
}
