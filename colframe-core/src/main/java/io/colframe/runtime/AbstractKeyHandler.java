package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.storage.Column;
import io.colframe.storage.Columns;
import io.colframe.storage.DataFrameView;

/**
 * Abstract base class for key handlers providing the shared plumbing.
 * <p>
 * Subclasses implement the typed read, the primitive row order and the kind's
 * natural order.
 *
 * @param <T> the Java type this handler supports
 */
public abstract class AbstractKeyHandler<T> implements KeyHandler<T> {

    private final ColumnType columnType;
    private final Class<T> javaType;

    protected AbstractKeyHandler(ColumnType columnType, Class<T> javaType) {
        this.columnType = columnType;
        this.javaType = javaType;
    }

    @Override
    public ColumnType getColumnType() {
        return columnType;
    }

    @Override
    public Class<T> getJavaType() {
        return javaType;
    }

    @Override
    public T read(Column column, int row) {
        checkType(column);
        return readChecked(column, row);
    }

    @Override
    public RowOrder rowOrder(Column column, DataFrameView view) {
        checkType(column);
        return rowOrderChecked(column, view);
    }

    /**
     * Read from a column already known to be of this handler's type.
     */
    protected abstract T readChecked(Column column, int row);

    protected abstract RowOrder rowOrderChecked(Column column, DataFrameView view);

    private void checkType(Column column) {
        if (!columnType.equals(column.type())) {
            throw new IllegalArgumentException("Handler for " + columnType + " cannot read column '"
                    + column.name() + "' of type " + column.type());
        }
    }

    @Override
    public String render(T value) {
        return Columns.render(columnType, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + columnType + "]";
    }
}
