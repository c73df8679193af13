package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.runtime.StringOrder;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.StringColumn;

/**
 * Key handler for String columns. The NA string sorts first.
 */
public class StringKeyHandler extends AbstractKeyHandler<String> {

    public StringKeyHandler() {
        super(ColumnType.STRING, String.class);
    }

    @Override
    protected String readChecked(Column column, int row) {
        return ((StringColumn) column).getString(row);
    }

    @Override
    public int compare(String left, String right) {
        return StringOrder.compare(left, right);
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var source = (StringColumn) column;
        var values = new String[view.rowCount()];
        for (var row = 0; row < values.length; row++) {
            values[row] = source.getString(view.sourceRow(row));
        }
        return (left, right) -> StringOrder.compare(values[left], values[right]);
    }
}
