package org.dynamis.exprtree;

public class ExpressionTreeException extends RuntimeException {

    public ExpressionTreeException(String message) {
        super(message);
    }

    public ExpressionTreeException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExpressionTreeException(Throwable cause) {
        super(cause);
    }
}
