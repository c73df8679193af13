package io.colframe.core;

/**
 * Missing-value policy: three lookup tables keyed by column type.
 * <p>
 * The tables are distinct and agree only where the kind has a
 * natural NA value (NaN for floats, the NA string):
 * <ul>
 *   <li>{@link #missing(ColumnType)}: strict NA, fails for kinds without a natural NA</li>
 *   <li>{@link #missingOrDefault(ColumnType)}: the kind's neutral value, never fails for a known kind</li>
 *   <li>{@link #sentinelMissing(ColumnType)}: an out-of-band extreme value, fails for booleans</li>
 * </ul>
 * Vector columns have {@code null} in all three tables. The NA string is {@code null}.
 * UInt32 values are carried in an {@code int}; the UInt32 maximum is therefore {@code -1}.
 */
public final class MissingValues {

    /**
     * Bit pattern of {@code uint32::MAX} in an {@code int}.
     */
    public static final int UINT_MAX = 0xFFFFFFFF;

    private MissingValues() {
    }

    /**
     * Strict NA value.
     *
     * @param type the column type
     * @return the NA value, boxed
     * @throws MissingValueUnavailableException for Bool, Int32 and Int64
     * @throws UnsupportedKindException         for kinds with no table entry
     */
    public static Object missing(ColumnType type) {
        if (type.isVector()) {
            return null;
        }
        return switch (type.typeCode()) {
            case TypeCodes.TYPE_BOOLEAN -> throw unavailable("NA is not available for bool", type);
            case TypeCodes.TYPE_INT -> throw unavailable("NA is not available for int", type);
            case TypeCodes.TYPE_UINT -> 0;
            case TypeCodes.TYPE_LONG -> throw unavailable("NA is not available for long", type);
            case TypeCodes.TYPE_FLOAT -> Float.NaN;
            case TypeCodes.TYPE_DOUBLE -> Double.NaN;
            case TypeCodes.TYPE_STRING -> null;
            default -> throw new UnsupportedKindException("Missing value", type);
        };
    }

    /**
     * Default substitute: the kind's zero, false or NaN.
     *
     * @param type the column type
     * @return the substitute value, boxed
     * @throws UnsupportedKindException for kinds with no table entry
     */
    public static Object missingOrDefault(ColumnType type) {
        if (type.isVector()) {
            return null;
        }
        return switch (type.typeCode()) {
            case TypeCodes.TYPE_BOOLEAN -> false;
            case TypeCodes.TYPE_INT, TypeCodes.TYPE_UINT -> 0;
            case TypeCodes.TYPE_LONG -> 0L;
            case TypeCodes.TYPE_FLOAT -> Float.NaN;
            case TypeCodes.TYPE_DOUBLE -> Double.NaN;
            case TypeCodes.TYPE_STRING -> null;
            default -> throw new UnsupportedKindException("Missing value", type);
        };
    }

    /**
     * Sentinel missing value: the kind's extreme value, NaN or the NA string.
     *
     * @param type the column type
     * @return the sentinel, boxed
     * @throws MissingValueUnavailableException for Bool
     * @throws UnsupportedKindException         for kinds with no table entry
     */
    public static Object sentinelMissing(ColumnType type) {
        if (type.isVector()) {
            return null;
        }
        return switch (type.typeCode()) {
            case TypeCodes.TYPE_BOOLEAN -> throw unavailable("No missing value for boolean. Convert to int.", type);
            case TypeCodes.TYPE_INT -> Integer.MIN_VALUE;
            case TypeCodes.TYPE_UINT -> UINT_MAX;
            case TypeCodes.TYPE_LONG -> Long.MIN_VALUE;
            case TypeCodes.TYPE_FLOAT -> Float.NaN;
            case TypeCodes.TYPE_DOUBLE -> Double.NaN;
            case TypeCodes.TYPE_STRING -> null;
            default -> throw new UnsupportedKindException("Missing value", type);
        };
    }

    private static MissingValueUnavailableException unavailable(String message, ColumnType type) {
        return new MissingValueUnavailableException(message, type);
    }
}
