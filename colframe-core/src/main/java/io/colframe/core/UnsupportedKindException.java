package io.colframe.core;

/**
 * A key or sort column has a kind (or vector item kind) with no comparison path.
 * Raised at dispatch time, before any row is read.
 */
public class UnsupportedKindException extends ColframeException {

    private final ColumnType columnType;

    public UnsupportedKindException(String operation, ColumnType columnType) {
        super(operation + " is not implemented for type '" + columnType + "'");
        this.columnType = columnType;
    }

    public ColumnType columnType() {
        return columnType;
    }
}
