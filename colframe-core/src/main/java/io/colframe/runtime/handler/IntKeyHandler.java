package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.IntColumn;

/**
 * Key handler for signed Int32 columns.
 */
public class IntKeyHandler extends AbstractKeyHandler<Integer> {

    public IntKeyHandler() {
        super(ColumnType.INT, Integer.class);
    }

    @Override
    protected Integer readChecked(Column column, int row) {
        return ((IntColumn) column).getInt(row);
    }

    @Override
    public int compare(Integer left, Integer right) {
        return Integer.compare(left, right);
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var source = (IntColumn) column;
        var values = new int[view.rowCount()];
        for (var row = 0; row < values.length; row++) {
            values[row] = source.getInt(view.sourceRow(row));
        }
        return (left, right) -> Integer.compare(values[left], values[right]);
    }
}
