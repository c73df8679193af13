package io.colframe.core;

/**
 * Type code constants for the closed set of column kinds.
 * <p>
 * Static byte constants rather than an enum: they index handler tables directly
 * and compile switch statements to a tableswitch.
 * <p>
 * The seven keyable kinds are the ones the sort, group-by and join engines know
 * how to compare. {@link #TYPE_SHORT} is storable but has no comparison path.
 */
public final class TypeCodes {

    public static final byte TYPE_BOOLEAN = 0;
    public static final byte TYPE_INT = 1;
    public static final byte TYPE_UINT = 2;
    public static final byte TYPE_LONG = 3;
    public static final byte TYPE_FLOAT = 4;
    public static final byte TYPE_DOUBLE = 5;
    public static final byte TYPE_STRING = 6;
    public static final byte TYPE_SHORT = 7;

    // Total count of type codes
    public static final int TYPE_COUNT = 8;

    private TypeCodes() { }

    /**
     * Check whether a type code has a registered comparison path.
     *
     * @param typeCode the type code
     * @return true for the seven keyable scalar kinds
     */
    public static boolean isKeyable(byte typeCode) {
        return switch (typeCode) {
            case TYPE_BOOLEAN, TYPE_INT, TYPE_UINT, TYPE_LONG, TYPE_FLOAT, TYPE_DOUBLE, TYPE_STRING -> true;
            default -> false;
        };
    }

    /**
     * Check whether a type code is a numeric kind.
     */
    public static boolean isNumeric(byte typeCode) {
        return switch (typeCode) {
            case TYPE_INT, TYPE_UINT, TYPE_LONG, TYPE_FLOAT, TYPE_DOUBLE, TYPE_SHORT -> true;
            default -> false;
        };
    }

    /**
     * Human readable kind name.
     *
     * @param typeCode the type code
     * @return the kind name
     * @throws IllegalArgumentException if the code is unknown
     */
    public static String name(byte typeCode) {
        return switch (typeCode) {
            case TYPE_BOOLEAN -> "Bool";
            case TYPE_INT -> "Int32";
            case TYPE_UINT -> "UInt32";
            case TYPE_LONG -> "Int64";
            case TYPE_FLOAT -> "Single";
            case TYPE_DOUBLE -> "Double";
            case TYPE_STRING -> "String";
            case TYPE_SHORT -> "Int16";
            default -> throw new IllegalArgumentException("Unknown type code: " + typeCode);
        };
    }

    /**
     * Validate a type code.
     *
     * @param typeCode the type code
     * @return the same code
     * @throws IllegalArgumentException if the code is unknown
     */
    public static byte checkTypeCode(byte typeCode) {
        if (typeCode < 0 || typeCode >= TYPE_COUNT) {
            throw new IllegalArgumentException("Unknown type code: " + typeCode);
        }
        return typeCode;
    }
}
