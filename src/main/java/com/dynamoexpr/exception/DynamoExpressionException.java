package com.dynamoexpr.exception;

/**
 * Base exception for the expression library.
 */
public class DynamoExpressionException extends RuntimeException {

    public DynamoExpressionException(String message) {
        super(message);
    }

    public DynamoExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
