package io.colframe.core;

/**
 * Raised when the key columns have a shape no code path exists for: vector
 * columns used as group or join keys, or a key arity outside 1..3.
 */
public class UnsupportedShapeException extends ColframeException {

    public UnsupportedShapeException(String message) {
        super(message);
    }
}
