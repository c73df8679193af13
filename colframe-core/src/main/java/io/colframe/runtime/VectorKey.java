package io.colframe.runtime;

import io.colframe.core.TypeCodes;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;

/**
 * Order-preserving wrapper around a vector cell, so vector columns can be sort
 * keys.
 * <p>
 * Two keys are equal only when their cells are bit identical (floats compared
 * through {@link Float#floatToIntBits(float)}). The order is deterministic:
 * missing cells first, then shorter vectors, then item by item in the item kind's
 * natural order. Vector keys are never used for grouping or joining.
 */
public final class VectorKey {
    private final byte itemTypeCode;
    private final Object cell;

    public VectorKey(byte itemTypeCode, Object cell) {
        this.itemTypeCode = itemTypeCode;
        this.cell = cell;
    }

    public byte itemTypeCode() {
        return itemTypeCode;
    }

    public Object cell() {
        return cell;
    }

    public int length() {
        return cell == null ? 0 : Array.getLength(cell);
    }

    /**
     * Deterministic total order over vectors of the same item kind.
     */
    public static int compare(VectorKey left, VectorKey right) {
        if (left.cell == right.cell) {
            return 0;
        }
        if (left.cell == null) {
            return -1;
        }
        if (right.cell == null) {
            return 1;
        }
        var cmp = Integer.compare(left.length(), right.length());
        if (cmp != 0) {
            return cmp;
        }
        return switch (left.itemTypeCode) {
            case TypeCodes.TYPE_BOOLEAN -> compareItems((boolean[]) left.cell, (boolean[]) right.cell);
            case TypeCodes.TYPE_INT -> Arrays.compare((int[]) left.cell, (int[]) right.cell);
            case TypeCodes.TYPE_UINT -> Arrays.compareUnsigned((int[]) left.cell, (int[]) right.cell);
            case TypeCodes.TYPE_LONG -> Arrays.compare((long[]) left.cell, (long[]) right.cell);
            case TypeCodes.TYPE_FLOAT -> Arrays.compare((float[]) left.cell, (float[]) right.cell);
            case TypeCodes.TYPE_DOUBLE -> Arrays.compare((double[]) left.cell, (double[]) right.cell);
            case TypeCodes.TYPE_STRING -> compareItems((String[]) left.cell, (String[]) right.cell);
            default -> throw new IllegalStateException("No vector order for item kind "
                    + TypeCodes.name(left.itemTypeCode));
        };
    }

    private static int compareItems(boolean[] left, boolean[] right) {
        for (var i = 0; i < left.length; i++) {
            var cmp = Boolean.compare(left[i], right[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int compareItems(String[] left, String[] right) {
        for (var i = 0; i < left.length; i++) {
            var cmp = StringOrder.compare(left[i], right[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof VectorKey other)) {
            return false;
        }
        if (itemTypeCode != other.itemTypeCode) {
            return false;
        }
        if (cell == null || other.cell == null) {
            return cell == other.cell;
        }
        if (cell instanceof boolean[] values) {
            return Arrays.equals(values, (boolean[]) other.cell);
        }
        if (cell instanceof int[] values) {
            return Arrays.equals(values, (int[]) other.cell);
        }
        if (cell instanceof long[] values) {
            return Arrays.equals(values, (long[]) other.cell);
        }
        if (cell instanceof float[] values) {
            return Arrays.equals(values, (float[]) other.cell);
        }
        if (cell instanceof double[] values) {
            return Arrays.equals(values, (double[]) other.cell);
        }
        if (cell instanceof short[] values) {
            return Arrays.equals(values, (short[]) other.cell);
        }
        return Arrays.equals((Object[]) cell, (Object[]) other.cell);
    }

    @Override
    public int hashCode() {
        int hash;
        if (cell == null) {
            hash = 0;
        } else if (cell instanceof boolean[] values) {
            hash = Arrays.hashCode(values);
        } else if (cell instanceof int[] values) {
            hash = Arrays.hashCode(values);
        } else if (cell instanceof long[] values) {
            hash = Arrays.hashCode(values);
        } else if (cell instanceof float[] values) {
            hash = Arrays.hashCode(values);
        } else if (cell instanceof double[] values) {
            hash = Arrays.hashCode(values);
        } else if (cell instanceof short[] values) {
            hash = Arrays.hashCode(values);
        } else {
            hash = Arrays.hashCode((Object[]) cell);
        }
        return Objects.hash(itemTypeCode, hash);
    }

    @Override
    public String toString() {
        return "VectorKey[" + TypeCodes.name(itemTypeCode) + ", length=" + length() + "]";
    }
}
