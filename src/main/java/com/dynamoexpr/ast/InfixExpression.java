package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

/**
 * Binary comparison or logical connective.
 *
 * @param token    Operator token
 * @param operator Operator text as written
 * @param left     Left operand
 * @param right    Right operand, null if it failed to parse
 */
public record InfixExpression(Token token, String operator, Expression left, Expression right)
        implements Expression {

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
