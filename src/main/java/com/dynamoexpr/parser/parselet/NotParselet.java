package com.dynamoexpr.parser.parselet;

import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.ast.PrefixExpression;
import com.dynamoexpr.parser.ExpressionParser;
import com.dynamoexpr.parser.Precedence;
import com.dynamoexpr.parser.PrefixParselet;
import com.dynamoexpr.token.Token;

/**
 * {@code NOT operand}. The operand is parsed at NOT precedence, so it takes a following
 * comparison but stops before AND/OR.
 */
public class NotParselet implements PrefixParselet {

    @Override
    public Expression parse(ExpressionParser parser) {
        Token operator = parser.current();
        parser.advance();
        Expression operand = parser.parseExpression(Precedence.NOT);
        return new PrefixExpression(operator, operator.literal(), operand);
    }
}
