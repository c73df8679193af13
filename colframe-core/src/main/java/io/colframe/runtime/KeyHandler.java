package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;

import java.util.Comparator;

/**
 * Typed access and ordering for one column kind.
 * <p>
 * One handler exists per comparable kind; the dispatcher picks handlers by the
 * runtime type of each key column, so the comparison code run for a column is
 * always the one written for its concrete kind.
 *
 * @param <T> the Java type of key components of this kind
 */
public interface KeyHandler<T> extends Comparator<T> {

    /**
     * The column type this handler reads.
     */
    ColumnType getColumnType();

    Class<T> getJavaType();

    /**
     * Read the value at a source row of a column of this handler's type.
     */
    T read(Column column, int row);

    /**
     * Read a column of this handler's type for every row of a view and order the
     * view rows by those values, in the kind's natural order.
     */
    RowOrder rowOrder(Column column, DataFrameView view);

    /**
     * Natural order of the kind.
     */
    @Override
    int compare(T left, T right);

    /**
     * Render a key component for group labels.
     */
    String render(T value);
}
