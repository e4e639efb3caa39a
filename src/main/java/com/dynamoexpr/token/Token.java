package com.dynamoexpr.token;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param literal  Raw source text of the token
 * @param position Position in the input string
 */
public record Token(TokenType type, String literal, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + literal + ")";
    }
}
