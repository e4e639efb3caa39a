package com.dynamoexpr.parser;

import com.dynamoexpr.ast.Expression;

/**
 * Parses the continuation of an expression after its left operand.
 */
@FunctionalInterface
public interface InfixParselet {

    /**
     * @param parser Parser positioned on the operator token
     * @param left   Expression parsed so far
     * @return Combined expression, or null if the construct failed (an error has been recorded)
     */
    Expression parse(ExpressionParser parser, Expression left);
}
