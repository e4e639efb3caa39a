package com.dynamoexpr.parser.parselet;

import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.parser.ExpressionParser;
import com.dynamoexpr.parser.Precedence;
import com.dynamoexpr.parser.PrefixParselet;
import com.dynamoexpr.token.TokenType;

/**
 * Parenthesised sub-expression. Grouping produces no node of its own.
 */
public class GroupParselet implements PrefixParselet {

    @Override
    public Expression parse(ExpressionParser parser) {
        parser.advance();
        Expression inner = parser.parseExpression(Precedence.LOWEST);

        if (!parser.expectLookahead(TokenType.RPAREN)) {
            return null;
        }
        return inner;
    }
}
