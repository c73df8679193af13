package io.colframe.runtime;

import io.colframe.core.ColumnType;

/**
 * Label of one grouping column for one group: which column, and the group's
 * value in it.
 *
 * @param columnIndex index of the key column in the grouped view
 * @param columnName  name of the key column
 * @param columnType  type of the key column
 * @param value       the typed value, boxed (UInt32 as its {@code int} bit pattern)
 * @param text        the rendered value
 */
public record GroupKey(int columnIndex, String columnName, ColumnType columnType, Object value, String text) {

    @Override
    public String toString() {
        return columnName + "=" + text;
    }
}
