package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.storage.Column;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.FloatColumn;

/**
 * Key handler for Single columns.
 * <p>
 * Uses {@link Float#compare(float, float)}: NaN sorts after every number and is
 * equal to itself, so missing values form one group. {@code -0.0f} is read as
 * {@code 0.0f}, so the two zeros are one key. This agrees with
 * {@link Float#equals(Object)} on the values read.
 */
public class FloatKeyHandler extends AbstractKeyHandler<Float> {

    public FloatKeyHandler() {
        super(ColumnType.FLOAT, Float.class);
    }

    @Override
    protected Float readChecked(Column column, int row) {
        return canonical(((FloatColumn) column).getFloat(row));
    }

    @Override
    public int compare(Float left, Float right) {
        return Float.compare(left, right);
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var source = (FloatColumn) column;
        var values = new float[view.rowCount()];
        for (var row = 0; row < values.length; row++) {
            values[row] = canonical(source.getFloat(view.sourceRow(row)));
        }
        return (left, right) -> Float.compare(values[left], values[right]);
    }

    /**
     * {@code -0.0f} read as {@code 0.0f}, so both zeros form one key.
     */
    static float canonical(float value) {
        return value == 0.0f ? 0.0f : value;
    }
}
