package com.dynamoexpr.exception;

/**
 * Exception thrown when the expression configuration cannot be loaded or is invalid.
 */
public class ConfigurationException extends DynamoExpressionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
