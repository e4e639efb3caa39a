package com.dynamoexpr.parser;

import com.dynamoexpr.ast.Expression;

/**
 * Parses an expression that starts with the parser's current token.
 */
@FunctionalInterface
public interface PrefixParselet {

    /**
     * @param parser Parser positioned on the token this parselet is registered for
     * @return Parsed expression, or null if the construct failed (an error has been recorded)
     */
    Expression parse(ExpressionParser parser);
}
