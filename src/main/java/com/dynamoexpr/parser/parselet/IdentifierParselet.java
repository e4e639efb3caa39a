package com.dynamoexpr.parser.parselet;

import com.dynamoexpr.ast.Identifier;
import com.dynamoexpr.parser.ExpressionParser;
import com.dynamoexpr.parser.PrefixParselet;
import com.dynamoexpr.token.Token;

/**
 * Turns the current token into an {@link Identifier} leaf.
 */
public class IdentifierParselet implements PrefixParselet {

    @Override
    public Identifier parse(ExpressionParser parser) {
        Token token = parser.current();
        return new Identifier(token, token.literal());
    }
}
