package com.dynamoexpr.parser.parselet;

import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.ast.InfixExpression;
import com.dynamoexpr.parser.ExpressionParser;
import com.dynamoexpr.parser.InfixParselet;
import com.dynamoexpr.parser.Precedence;
import com.dynamoexpr.token.Token;

/**
 * Comparison operators and the AND/OR connectives.
 * The right operand is parsed at the operator's own precedence, which makes them left-associative.
 */
public class BinaryOperatorParselet implements InfixParselet {

    public static final BinaryOperatorParselet INSTANCE = new BinaryOperatorParselet();

    @Override
    public Expression parse(ExpressionParser parser, Expression left) {
        Token operator = parser.current();
        Precedence precedence = parser.currentPrecedence();

        parser.advance();
        Expression right = parser.parseExpression(precedence);

        return new InfixExpression(operator, operator.literal(), left, right);
    }
}
