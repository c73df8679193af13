package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.IntColumn;

/**
 * Key handler for UInt32 columns.
 * <p>
 * Values travel as the {@code int} bit pattern; only the order differs from
 * {@link IntKeyHandler}: {@code 0xFFFFFFFF} is the largest value, not {@code -1}.
 */
public class UIntKeyHandler extends AbstractKeyHandler<Integer> {

    public UIntKeyHandler() {
        super(ColumnType.UINT, Integer.class);
    }

    @Override
    protected Integer readChecked(Column column, int row) {
        return ((IntColumn) column).getInt(row);
    }

    @Override
    public int compare(Integer left, Integer right) {
        return Integer.compareUnsigned(left, right);
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var source = (IntColumn) column;
        var values = new int[view.rowCount()];
        for (var row = 0; row < values.length; row++) {
            values[row] = source.getInt(view.sourceRow(row));
        }
        return (left, right) -> Integer.compareUnsigned(values[left], values[right]);
    }
}
