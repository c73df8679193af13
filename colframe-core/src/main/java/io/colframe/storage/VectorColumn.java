package io.colframe.storage;

import io.colframe.core.ColumnType;
import io.colframe.core.TypeCodes;

/**
 * Column whose cells are variable width vectors of a scalar item kind.
 * <p>
 * Each cell is a primitive array matching the item kind ({@code boolean[]},
 * {@code int[]} for Int32 and UInt32, {@code long[]}, {@code float[]},
 * {@code double[]}, {@code short[]}) or a {@code String[]}; a {@code null} cell
 * is a missing vector. Cells are shared, callers must not mutate them.
 */
public final class VectorColumn extends AbstractColumn {
    private final Object[] cells;

    public VectorColumn(String name, ColumnType type, Object[] cells) {
        super(name, type);
        if (!type.isVector()) {
            throw new IllegalArgumentException("VectorColumn requires a vector type, got " + type);
        }
        var expected = cellClass(type.itemTypeCode());
        for (var i = 0; i < cells.length; i++) {
            if (cells[i] != null && cells[i].getClass() != expected) {
                throw new IllegalArgumentException("Cell " + i + " of '" + name + "' must be "
                        + expected.getSimpleName() + ", got " + cells[i].getClass().getSimpleName());
            }
        }
        this.cells = cells.clone();
    }

    public static VectorColumn of(String name, byte itemTypeCode, Object... cells) {
        return new VectorColumn(name, ColumnType.vectorOf(itemTypeCode), cells);
    }

    static Class<?> cellClass(byte itemTypeCode) {
        return switch (itemTypeCode) {
            case TypeCodes.TYPE_BOOLEAN -> boolean[].class;
            case TypeCodes.TYPE_INT, TypeCodes.TYPE_UINT -> int[].class;
            case TypeCodes.TYPE_LONG -> long[].class;
            case TypeCodes.TYPE_FLOAT -> float[].class;
            case TypeCodes.TYPE_DOUBLE -> double[].class;
            case TypeCodes.TYPE_STRING -> String[].class;
            case TypeCodes.TYPE_SHORT -> short[].class;
            default -> throw new IllegalArgumentException("Unknown item type code: " + itemTypeCode);
        };
    }

    public Object getCell(int row) {
        return cells[row];
    }

    @Override
    public int size() {
        return cells.length;
    }

    @Override
    public Object get(int row) {
        checkRow(row);
        return cells[row];
    }

    @Override
    public Column take(int[] rows) {
        var taken = new Object[rows.length];
        for (var i = 0; i < rows.length; i++) {
            taken[i] = cells[rows[i]];
        }
        return new VectorColumn(name(), type(), taken);
    }

    @Override
    public Column rename(String name) {
        return new VectorColumn(name, type(), cells);
    }
}
