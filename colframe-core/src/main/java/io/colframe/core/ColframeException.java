package io.colframe.core;

public class ColframeException extends RuntimeException {

    public ColframeException(Throwable cause) {
        super(cause);
    }

    public ColframeException(String message, Throwable cause) {
        super(message, cause);
    }

    public ColframeException(String message) {
        super(message);
    }

}
