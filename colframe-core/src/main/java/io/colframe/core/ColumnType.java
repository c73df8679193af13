package io.colframe.core;

/**
 * Runtime type of a column: a scalar kind, or a vector whose cells hold items of
 * a scalar kind.
 *
 * @param itemTypeCode the scalar kind, or the item kind of a vector
 * @param vector       whether cells are vectors
 */
public record ColumnType(byte itemTypeCode, boolean vector) {

    public static final ColumnType BOOLEAN = scalar(TypeCodes.TYPE_BOOLEAN);
    public static final ColumnType INT = scalar(TypeCodes.TYPE_INT);
    public static final ColumnType UINT = scalar(TypeCodes.TYPE_UINT);
    public static final ColumnType LONG = scalar(TypeCodes.TYPE_LONG);
    public static final ColumnType FLOAT = scalar(TypeCodes.TYPE_FLOAT);
    public static final ColumnType DOUBLE = scalar(TypeCodes.TYPE_DOUBLE);
    public static final ColumnType STRING = scalar(TypeCodes.TYPE_STRING);
    public static final ColumnType SHORT = scalar(TypeCodes.TYPE_SHORT);

    public ColumnType {
        TypeCodes.checkTypeCode(itemTypeCode);
    }

    public static ColumnType scalar(byte typeCode) {
        return new ColumnType(typeCode, false);
    }

    public static ColumnType vectorOf(byte itemTypeCode) {
        return new ColumnType(itemTypeCode, true);
    }

    public boolean isVector() {
        return vector;
    }

    /**
     * Raw kind of a scalar column.
     *
     * @throws IllegalStateException for vector columns, use {@link #itemTypeCode()}
     */
    public byte typeCode() {
        if (vector) {
            throw new IllegalStateException("Vector column has no scalar kind: " + this);
        }
        return itemTypeCode;
    }

    public boolean isKeyable() {
        return !vector && TypeCodes.isKeyable(itemTypeCode);
    }

    public String name() {
        var item = TypeCodes.name(itemTypeCode);
        return vector ? "Vec<" + item + ">" : item;
    }

    @Override
    public String toString() {
        return name();
    }
}
