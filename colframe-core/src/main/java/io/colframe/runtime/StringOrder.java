package io.colframe.runtime;

/**
 * Order of string values: the NA string ({@code null}) first, then lexicographic.
 */
public final class StringOrder {

    private StringOrder() {
    }

    public static int compare(String left, String right) {
        if (left == null && right == null) {
            return 0;
        }
        if (left == null) {
            return -1;
        }
        if (right == null) {
            return 1;
        }
        return left.compareTo(right);
    }
}
