package io.colframe.core;

/**
 * Join key columns differ in count or pairwise type.
 */
public class SchemaMismatchException extends ColframeException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
