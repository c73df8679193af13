package io.colframe.storage;

import io.colframe.core.ColumnType;

/**
 * 32-bit integer column, signed (Int32) or unsigned (UInt32).
 * <p>
 * UInt32 values share the {@code int} storage and are interpreted with
 * {@link Integer#compareUnsigned(int, int)} and {@link Integer#toUnsignedString(int)}.
 */
public final class IntColumn extends AbstractColumn {
    private final int[] values;

    public IntColumn(String name, ColumnType type, int[] values) {
        super(name, checkType(type));
        this.values = values.clone();
    }

    public static IntColumn of(String name, int... values) {
        return new IntColumn(name, ColumnType.INT, values);
    }

    public static IntColumn unsigned(String name, int... values) {
        return new IntColumn(name, ColumnType.UINT, values);
    }

    private static ColumnType checkType(ColumnType type) {
        if (!ColumnType.INT.equals(type) && !ColumnType.UINT.equals(type)) {
            throw new IllegalArgumentException("IntColumn holds Int32 or UInt32, not " + type);
        }
        return type;
    }

    public boolean isUnsigned() {
        return ColumnType.UINT.equals(type());
    }

    public int getInt(int row) {
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
        var taken = new int[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new IntColumn(name(), type(), taken);
    }

    @Override
    public Column rename(String name) {
        return new IntColumn(name, type(), values);
    }
}
