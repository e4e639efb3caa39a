package com.dynamoexpr.exception;

import java.util.List;

/**
 * Exception thrown by the throwing parse entry points when the parser recorded diagnostics.
 * The parser itself never throws; it accumulates errors and returns them with the tree.
 */
public class ExpressionSyntaxException extends DynamoExpressionException {

    private final String expression;
    private final List<String> errors;

    public ExpressionSyntaxException(String expression, List<String> errors) {
        super("Invalid expression '" + expression + "': " + String.join("; ", errors));
        this.expression = expression;
        this.errors = List.copyOf(errors);
    }

    public String getExpression() {
        return expression;
    }

    public List<String> getErrors() {
        return errors;
    }
}
