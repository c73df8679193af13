package io.colframe.storage;

import io.colframe.core.ColumnType;

public final class DoubleColumn extends AbstractColumn {
    private final double[] values;

    public DoubleColumn(String name, double[] values) {
        super(name, ColumnType.DOUBLE);
        this.values = values.clone();
    }

    public static DoubleColumn of(String name, double... values) {
        return new DoubleColumn(name, values);
    }

    public double getDouble(int row) {
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
        var taken = new double[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new DoubleColumn(name(), taken);
    }

    @Override
    public Column rename(String name) {
        return new DoubleColumn(name, values);
    }
}
