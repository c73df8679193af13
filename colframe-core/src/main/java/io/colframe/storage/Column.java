package io.colframe.storage;

import io.colframe.core.ColumnType;

/**
 * A named, homogeneously typed, immutable sequence of values.
 * <p>
 * Typed subclasses expose primitive accessors; {@link #get(int)} boxes and is
 * meant for rendering and for building new columns, not for hot loops.
 */
public interface Column {
    String name();

    ColumnType type();

    int size();

    /**
     * Boxed value at a row. UInt32 values are returned as their {@code int} bit pattern.
     */
    Object get(int row);

    /**
     * Copy the given rows, in order, into a new column with the same name and type.
     */
    Column take(int[] rows);

    Column rename(String name);

    /**
     * Returns the type code for this column's items.
     * Used for switching on kinds in hot paths.
     */
    default byte typeCode() {
        return type().itemTypeCode();
    }
}
