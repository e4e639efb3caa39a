package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

/**
 * {@code subject BETWEEN low AND high}. Bounds are always identifiers.
 *
 * @param token   BETWEEN token
 * @param subject Tested expression
 * @param low     Lower bound (inclusive)
 * @param high    Upper bound (inclusive)
 */
public record BetweenExpression(Token token, Expression subject, Identifier low, Identifier high)
        implements Expression {

    @Override
    public String toString() {
        return "(" + subject + " " + tokenLiteral() + " " + low + " AND " + high + ")";
    }
}
