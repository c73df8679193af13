package io.colframe.runtime;

/**
 * Which unmatched groups a join emits. Matched groups are emitted by every strategy.
 */
public enum JoinStrategy {
    INNER(false, false),
    LEFT(true, false),
    RIGHT(false, true),
    OUTER(true, true);

    private final boolean keepsLeftOnly;
    private final boolean keepsRightOnly;

    JoinStrategy(boolean keepsLeftOnly, boolean keepsRightOnly) {
        this.keepsLeftOnly = keepsLeftOnly;
        this.keepsRightOnly = keepsRightOnly;
    }

    /**
     * Whether left groups without a right match are emitted, right columns filled.
     */
    public boolean keepsLeftOnly() {
        return keepsLeftOnly;
    }

    /**
     * Whether right groups without a left match are emitted, left columns filled.
     */
    public boolean keepsRightOnly() {
        return keepsRightOnly;
    }
}
