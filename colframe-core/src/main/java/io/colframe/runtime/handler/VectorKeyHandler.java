package io.colframe.runtime.handler;

import io.colframe.core.ColumnType;
import io.colframe.runtime.AbstractKeyHandler;
import io.colframe.runtime.RowOrder;
import io.colframe.runtime.VectorKey;
import io.colframe.storage.Column;
import io.colframe.storage.Columns;
import io.colframe.storage.DataFrameView;
import io.colframe.storage.VectorColumn;

/**
 * Key handler wrapping vector cells of one item kind into {@link VectorKey}s.
 * Registered for sorting only.
 */
public class VectorKeyHandler extends AbstractKeyHandler<VectorKey> {

    public VectorKeyHandler(byte itemTypeCode) {
        super(ColumnType.vectorOf(itemTypeCode), VectorKey.class);
    }

    @Override
    protected VectorKey readChecked(Column column, int row) {
        return new VectorKey(getColumnType().itemTypeCode(), ((VectorColumn) column).getCell(row));
    }

    @Override
    public int compare(VectorKey left, VectorKey right) {
        return VectorKey.compare(left, right);
    }

    @Override
    public String render(VectorKey value) {
        return Columns.render(getColumnType(), value.cell());
    }

    @Override
    protected RowOrder rowOrderChecked(Column column, DataFrameView view) {
        var keys = new VectorKey[view.rowCount()];
        for (var row = 0; row < keys.length; row++) {
            keys[row] = readChecked(column, view.sourceRow(row));
        }
        return (left, right) -> VectorKey.compare(keys[left], keys[right]);
    }
}
