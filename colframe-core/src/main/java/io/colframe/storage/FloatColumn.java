package io.colframe.storage;

import io.colframe.core.ColumnType;

public final class FloatColumn extends AbstractColumn {
    private final float[] values;

    public FloatColumn(String name, float[] values) {
        super(name, ColumnType.FLOAT);
        this.values = values.clone();
    }

    public static FloatColumn of(String name, float... values) {
        return new FloatColumn(name, values);
    }

    public float getFloat(int row) {
        return values[row];
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public Object get(int row) {
        checkRow(row);
        return values[row];
    }

    @Override
    public Column take(int[] rows) {
        var taken = new float[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new FloatColumn(name(), taken);
    }

    @Override
    public Column rename(String name) {
        return new FloatColumn(name, values);
    }
}
