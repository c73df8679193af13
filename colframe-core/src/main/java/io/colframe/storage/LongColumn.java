package io.colframe.storage;

import io.colframe.core.ColumnType;

public final class LongColumn extends AbstractColumn {
    private final long[] values;

    public LongColumn(String name, long[] values) {
        super(name, ColumnType.LONG);
        this.values = values.clone();
    }

    public static LongColumn of(String name, long... values) {
        return new LongColumn(name, values);
    }

    public long getLong(int row) {
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
        var taken = new long[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new LongColumn(name(), taken);
    }

    @Override
    public Column rename(String name) {
        return new LongColumn(name, values);
    }
}
