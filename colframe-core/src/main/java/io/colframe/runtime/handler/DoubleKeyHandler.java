package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.DoubleColumn;

/**
 * Key handler for Double columns, ordered like {@link FloatKeyHandler}.
 */
public class DoubleKeyHandler extends AbstractKeyHandler<Double> {

    public DoubleKeyHandler() {
        super(ColumnType.DOUBLE, Double.class);
    }

    @Override
    protected Double readChecked(Column column, int row) {
        return canonical(((DoubleColumn) column).getDouble(row));
    }

    @Override
    public int compare(Double left, Double right) {
        return Double.compare(left, right);
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var source = (DoubleColumn) column;
        var values = new double[view.rowCount()];
        for (var row = 0; row < values.length; row++) {
            values[row] = canonical(source.getDouble(view.sourceRow(row)));
        }
        return (left, right) -> Double.compare(values[left], values[right]);
    }

    static double canonical(double value) {
        return value == 0.0 ? 0.0 : value;
    }
}
