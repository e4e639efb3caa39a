package com.dynamoexpr.parser.parselet;

import com.dynamoexpr.ast.BetweenExpression;
import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.ast.Identifier;
import com.dynamoexpr.parser.ExpressionParser;
import com.dynamoexpr.parser.InfixParselet;
import com.dynamoexpr.token.Token;
import com.dynamoexpr.token.TokenType;

/**
 * {@code subject BETWEEN low AND high}, where both bounds must be identifiers.
 */
public class BetweenParselet implements InfixParselet {

    @Override
    public Expression parse(ExpressionParser parser, Expression left) {
        Token between = parser.current();

        if (!parser.expectLookahead(TokenType.IDENT)) {
            return null;
        }
        Identifier low = identifier(parser.current());

        if (!parser.expectLookahead(TokenType.AND)) {
            return null;
        }

        if (!parser.expectLookahead(TokenType.IDENT)) {
            return null;
        }
        Identifier high = identifier(parser.current());

        return new BetweenExpression(between, left, low, high);
    }

    private Identifier identifier(Token token) {
        return new Identifier(token, token.literal());
    }
}
