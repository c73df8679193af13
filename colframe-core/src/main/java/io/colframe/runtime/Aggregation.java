package io.colframe.runtime;

/**
 * Per-group reduction of the non-key columns.
 */
public enum Aggregation {
    /**
     * Number of rows, as Int64, for every column.
     */
    COUNT,

    /**
     * Numeric sum in the column's own kind, logical or for Bool, concatenation for String.
     */
    SUM,

    MIN,

    MAX,

    /**
     * Double mean for numeric kinds; other kinds hold their default substitute value.
     */
    MEAN
}
