package io.colframe.storage;

import io.colframe.core.ColumnType;

/**
 * Int16 column. Storable and copyable, but not usable as a key.
 */
public final class ShortColumn extends AbstractColumn {
    private final short[] values;

    public ShortColumn(String name, short[] values) {
        super(name, ColumnType.SHORT);
        this.values = values.clone();
    }

    public static ShortColumn of(String name, short... values) {
        return new ShortColumn(name, values);
    }

    public short getShort(int row) {
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
        var taken = new short[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new ShortColumn(name(), taken);
    }

    @Override
    public Column rename(String name) {
        return new ShortColumn(name, values);
    }
}
