package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

/**
 * Unary operator applied to one operand. Only {@code NOT} is produced by the parser.
 *
 * @param token    Operator token
 * @param operator Operator text as written
 * @param operand  Operand, null if it failed to parse
 */
public record PrefixExpression(Token token, String operator, Expression operand) implements Expression {

    @Override
    public String toString() {
        return "(" + operator + " " + operand + ")";
    }
}
