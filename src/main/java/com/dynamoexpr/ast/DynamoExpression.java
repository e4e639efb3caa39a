package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

import java.util.Optional;

/**
 * Root of a parsed condition expression.
 *
 * @param statement The statement, or null when the input held no tokens
 */
public record DynamoExpression(ExpressionStatement statement) implements Node {

    /**
     * An expression with no statement.
     */
    public static DynamoExpression empty() {
        return new DynamoExpression(null);
    }

    public boolean isEmpty() {
        return statement == null;
    }

    /**
     * Top-level expression, empty for empty input or a failed statement.
     */
    public Optional<Expression> expression() {
        return statement == null ? Optional.empty() : Optional.ofNullable(statement.expression());
    }

    @Override
    public Token token() {
        return statement == null ? null : statement.token();
    }

    @Override
    public String toString() {
        return statement == null ? "" : statement.toString();
    }
}
