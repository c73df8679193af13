package io.colframe.core;

/**
 * A missing-value table has no representation for the requested kind.
 */
public class MissingValueUnavailableException extends ColframeException {

    private final ColumnType columnType;

    public MissingValueUnavailableException(String message, ColumnType columnType) {
        super(message);
        this.columnType = columnType;
    }

    public ColumnType columnType() {
        return columnType;
    }
}
