package io.colframe.runtime.dispatch;

import io.colframe.core.ColumnType;
import io.colframe.runtime.CompositeKey;
import io.colframe.runtime.GroupKey;
import io.colframe.runtime.KeyHandler;
import io.colframe.runtime.KeyPlan;
import io.colframe.runtime.RowOrder;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

abstract class AbstractKeyPlan<K extends CompositeKey> implements KeyPlan<K> {
    private final KeyHandler<?>[] handlers;
    private final List<ColumnType> columnTypes;

    AbstractKeyPlan(KeyHandler<?>... handlers) {
        this.handlers = handlers;
        var types = new ArrayList<ColumnType>(handlers.length);
        for (var handler : handlers) {
            types.add(handler.getColumnType());
        }
        this.columnTypes = Collections.unmodifiableList(types);
    }

    @Override
    public List<ColumnType> columnTypes() {
        return columnTypes;
    }

    /**
     * Source columns behind the key columns, checked against the plan's types.
     */
    final Column[] keyColumns(DataFrameView view, int[] keyColumns) {
        if (keyColumns == null || keyColumns.length != handlers.length) {
            throw new IllegalArgumentException("Plan for " + columnTypes + " needs " + handlers.length
                    + " key columns, got " + (keyColumns == null ? 0 : keyColumns.length));
        }
        var columns = new Column[keyColumns.length];
        for (var i = 0; i < keyColumns.length; i++) {
            columns[i] = view.column(keyColumns[i]);
            if (!columns[i].type().equals(columnTypes.get(i))) {
                throw new IllegalArgumentException("Key column '" + columns[i].name() + "' has type "
                        + columns[i].type() + ", plan expects " + columnTypes.get(i));
            }
        }
        return columns;
    }

    @Override
    public RowOrder rowOrder(DataFrameView view, int[] keyColumns) {
        var columns = keyColumns(view, keyColumns);
        var orders = new RowOrder[columns.length];
        for (var i = 0; i < columns.length; i++) {
            orders[i] = handlers[i].rowOrder(columns[i], view);
        }
        return RowOrder.lexicographic(orders);
    }

    @Override
    public K[] materialize(DataFrameView view, int[] keyColumns) {
        var reader = keyReader(view, keyColumns);
        var keys = newKeys(view.rowCount());
        for (var row = 0; row < keys.length; row++) {
            keys[row] = reader.apply(row);
        }
        return keys;
    }

    abstract K[] newKeys(int length);

    @Override
    public GroupKey[] labels(K key, DataFrameView view, int[] keyColumns) {
        var labels = new GroupKey[handlers.length];
        for (var i = 0; i < handlers.length; i++) {
            var value = key.get(i);
            labels[i] = new GroupKey(keyColumns[i], view.columnName(keyColumns[i]), columnTypes.get(i),
                    value, render(handlers[i], value));
        }
        return labels;
    }

    @SuppressWarnings("unchecked")
    private static <T> String render(KeyHandler<T> handler, Object value) {
        return handler.render((T) value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + columnTypes;
    }
}
