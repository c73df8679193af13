package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.storage.BooleanColumn;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;

/**
 * Key handler for Bool columns: {@code false} before {@code true}.
 */
public class BooleanKeyHandler extends AbstractKeyHandler<Boolean> {

    public BooleanKeyHandler() {
        super(ColumnType.BOOLEAN, Boolean.class);
    }

    @Override
    protected Boolean readChecked(Column column, int row) {
        return ((BooleanColumn) column).getBoolean(row);
    }

    @Override
    public int compare(Boolean left, Boolean right) {
        return Boolean.compare(left, right);
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var source = (BooleanColumn) column;
        var values = new boolean[view.rowCount()];
        for (var row = 0; row < values.length; row++) {
            values[row] = source.getBoolean(view.sourceRow(row));
        }
        return (left, right) -> Boolean.compare(values[left], values[right]);
    }
}
