package io.colframe.storage;

import io.colframe.core.ColumnType;

/**
 * String column. {@code null} cells are the NA string.
 */
public final class StringColumn extends AbstractColumn {
    private final String[] values;

    public StringColumn(String name, String[] values) {
        super(name, ColumnType.STRING);
        this.values = values.clone();
    }

    public static StringColumn of(String name, String... values) {
        return new StringColumn(name, values);
    }

    public String getString(int row) {
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
        var taken = new String[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new StringColumn(name(), taken);
    }

    @Override
    public Column rename(String name) {
        return new StringColumn(name, values);
    }
}
