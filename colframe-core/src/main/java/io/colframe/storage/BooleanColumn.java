package io.colframe.storage;

import io.colframe.core.ColumnType;

public final class BooleanColumn extends AbstractColumn {
    private final boolean[] values;

    public BooleanColumn(String name, boolean[] values) {
        super(name, ColumnType.BOOLEAN);
        this.values = values.clone();
    }

    public static BooleanColumn of(String name, boolean... values) {
        return new BooleanColumn(name, values);
    }

    public boolean getBoolean(int row) {
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
        var taken = new boolean[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new BooleanColumn(name(), taken);
    }

    @Override
    public Column rename(String name) {
        return new BooleanColumn(name, values);
    }
}
