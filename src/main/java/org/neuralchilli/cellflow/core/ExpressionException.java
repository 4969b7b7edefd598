package org.neuralchilli.cellflow.core;

/**
 * Exception thrown when a command template expression cannot be evaluated.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
