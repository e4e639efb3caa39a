package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

/**
 * Leaf naming an attribute path, a placeholder or a literal.
 *
 * @param token Identifier token
 * @param name  Raw identifier text
 */
public record Identifier(Token token, String name) implements Expression {

    @Override
    public String toString() {
        return name;
    }
}
