package io.colframe.runtime.dispatch;

/**
 * Operation a key plan is resolved for. Only sorting accepts vector key columns.
 */
public enum KeyUsage {
    SORT("Sort", true),
    GROUP_BY("GroupBy", false),
    JOIN("Join", false);

    private final String operationName;
    private final boolean vectorKeysAllowed;

    KeyUsage(String operationName, boolean vectorKeysAllowed) {
        this.operationName = operationName;
        this.vectorKeysAllowed = vectorKeysAllowed;
    }

    public String operationName() {
        return operationName;
    }

    public boolean vectorKeysAllowed() {
        return vectorKeysAllowed;
    }
}
