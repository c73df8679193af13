package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.LongColumn;

/**
 * Key handler for Int64 columns.
 */
public class LongKeyHandler extends AbstractKeyHandler<Long> {

    public LongKeyHandler() {
        super(ColumnType.LONG, Long.class);
    }

    @Override
    protected Long readChecked(Column column, int row) {
        return ((LongColumn) column).getLong(row);
    }

    @Override
    public int compare(Long left, Long right) {
        return Long.compare(left, right);
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var source = (LongColumn) column;
        var values = new long[view.rowCount()];
        for (var row = 0; row < values.length; row++) {
            values[row] = source.getLong(view.sourceRow(row));
        }
        return (left, right) -> Long.compare(values[left], values[right]);
    }
}
