package io.colframe.storage;

import io.colframe.core.ColumnType;
import io.colframe.core.TypeCodes;

import java.util.Arrays;
import java.util.List;

/**
 * Factory and rendering helpers for columns built from boxed values.
 */
public final class Columns {

    private Columns() {
    }

    /**
     * Build a column of the given type from boxed values.
     * <p>
     * Numeric values are narrowed with {@link Number} accessors; UInt32 values are
     * taken as their {@code int} bit pattern.
     *
     * @throws IllegalArgumentException if a value does not fit the type
     */
    public static Column fromValues(String name, ColumnType type, Object[] values) {
        if (type.isVector()) {
            return new VectorColumn(name, type, values);
        }
        var n = values.length;
        switch (type.typeCode()) {
            case TypeCodes.TYPE_BOOLEAN: {
                var data = new boolean[n];
                for (var i = 0; i < n; i++) {
                    data[i] = (Boolean) requireValue(name, type, values[i]);
                }
                return new BooleanColumn(name, data);
            }
            case TypeCodes.TYPE_INT:
            case TypeCodes.TYPE_UINT: {
                var data = new int[n];
                for (var i = 0; i < n; i++) {
                    data[i] = number(name, type, values[i]).intValue();
                }
                return new IntColumn(name, type, data);
            }
            case TypeCodes.TYPE_LONG: {
                var data = new long[n];
                for (var i = 0; i < n; i++) {
                    data[i] = number(name, type, values[i]).longValue();
                }
                return new LongColumn(name, data);
            }
            case TypeCodes.TYPE_FLOAT: {
                var data = new float[n];
                for (var i = 0; i < n; i++) {
                    data[i] = number(name, type, values[i]).floatValue();
                }
                return new FloatColumn(name, data);
            }
            case TypeCodes.TYPE_DOUBLE: {
                var data = new double[n];
                for (var i = 0; i < n; i++) {
                    data[i] = number(name, type, values[i]).doubleValue();
                }
                return new DoubleColumn(name, data);
            }
            case TypeCodes.TYPE_SHORT: {
                var data = new short[n];
                for (var i = 0; i < n; i++) {
                    data[i] = number(name, type, values[i]).shortValue();
                }
                return new ShortColumn(name, data);
            }
            case TypeCodes.TYPE_STRING: {
                var data = new String[n];
                for (var i = 0; i < n; i++) {
                    if (values[i] != null && !(values[i] instanceof String)) {
                        throw new IllegalArgumentException("Cannot convert " + values[i].getClass()
                                + " to String in column '" + name + "'");
                    }
                    data[i] = (String) values[i];
                }
                return new StringColumn(name, data);
            }
            default:
                throw new IllegalArgumentException("Unsupported column type: " + type);
        }
    }

    /**
     * Build a column of {@code length} copies of {@code value}.
     */
    public static Column filled(String name, ColumnType type, int length, Object value) {
        var values = new Object[length];
        Arrays.fill(values, value);
        return fromValues(name, type, values);
    }

    /**
     * Concatenate columns of the same type, in order, under a new name.
     */
    public static Column concat(String name, ColumnType type, List<Column> parts) {
        var total = 0;
        for (var part : parts) {
            if (!part.type().equals(type)) {
                throw new IllegalArgumentException("Column '" + name + "' has type " + type
                        + " in one frame and " + part.type() + " in another");
            }
            total += part.size();
        }
        var values = new Object[total];
        var pos = 0;
        for (var part : parts) {
            for (var row = 0; row < part.size(); row++) {
                values[pos++] = part.get(row);
            }
        }
        return fromValues(name, type, values);
    }

    /**
     * Render a boxed cell value of the given type. The NA string renders as empty.
     */
    public static String render(ColumnType type, Object value) {
        if (value == null) {
            return "";
        }
        if (type.isVector()) {
            return renderVector(value);
        }
        if (type.typeCode() == TypeCodes.TYPE_UINT) {
            return Integer.toUnsignedString((Integer) value);
        }
        return value.toString();
    }

    private static String renderVector(Object cell) {
        if (cell instanceof boolean[]) {
            return Arrays.toString((boolean[]) cell);
        }
        if (cell instanceof int[]) {
            return Arrays.toString((int[]) cell);
        }
        if (cell instanceof long[]) {
            return Arrays.toString((long[]) cell);
        }
        if (cell instanceof float[]) {
            return Arrays.toString((float[]) cell);
        }
        if (cell instanceof double[]) {
            return Arrays.toString((double[]) cell);
        }
        if (cell instanceof short[]) {
            return Arrays.toString((short[]) cell);
        }
        return Arrays.toString((Object[]) cell);
    }

    private static Object requireValue(String name, ColumnType type, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Column '" + name + "' of type " + type + " cannot hold null");
        }
        return value;
    }

    private static Number number(String name, ColumnType type, Object value) {
        if (!(requireValue(name, type, value) instanceof Number)) {
            throw new IllegalArgumentException("Cannot convert " + value.getClass() + " to " + type
                    + " in column '" + name + "'");
        }
        return (Number) value;
    }
}
