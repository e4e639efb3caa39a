package com.dynamoexpr.exception;

/**
 * Exception thrown when a parsed expression cannot be evaluated against an item,
 * e.g. an unknown function or a tree that still contains missing nodes.
 */
public class EvaluationException extends DynamoExpressionException {

    public EvaluationException(String message) {
        super(message);
    }
}
