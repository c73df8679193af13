package io.colframe.storage;

/**
 * How {@link DataFrame#multiply(int, MultiplyStrategy)} repeats rows.
 */
public enum MultiplyStrategy {
    /**
     * Repeat the whole frame: rows {@code 0..n-1, 0..n-1, ...}.
     */
    BLOCK,

    /**
     * Repeat each row in place: rows {@code 0, 0, ..., 1, 1, ...}.
     */
    ROW
}
