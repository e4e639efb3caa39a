package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

/**
 * Wraps the single top-level expression of an input.
 *
 * @param token      First token of the statement
 * @param expression Parsed expression, null if it failed to parse
 */
public record ExpressionStatement(Token token, Expression expression) implements Node {

    @Override
    public String toString() {
        return String.valueOf(expression);
    }
}
