package com.dynamoexpr.parser;

import com.dynamoexpr.token.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binding power of operators, from loosest to tightest.
 * <p>
 * BETWEEN binds tighter than equality and looser than the relational operators.
 */
public enum Precedence {
    LOWEST,
    OR,          // OR
    AND,         // AND
    NOT,         // NOT (unary)
    EQUALS,      // = <>
    BETWEEN,     // BETWEEN
    COMPARISON,  // < <= > >=
    CALL;        // myFunction(X)

    private static final Map<TokenType, Precedence> TABLE = new EnumMap<>(TokenType.class);

    static {
        TABLE.put(TokenType.EQ, EQUALS);
        TABLE.put(TokenType.NOT_EQ, EQUALS);
        TABLE.put(TokenType.BETWEEN, BETWEEN);
        TABLE.put(TokenType.LT, COMPARISON);
        TABLE.put(TokenType.GT, COMPARISON);
        TABLE.put(TokenType.LTE, COMPARISON);
        TABLE.put(TokenType.GTE, COMPARISON);
        TABLE.put(TokenType.AND, AND);
        TABLE.put(TokenType.OR, OR);
        TABLE.put(TokenType.LPAREN, CALL);
    }

    /**
     * Precedence of a token type, {@link #LOWEST} for tokens that are not operators.
     */
    public static Precedence of(TokenType type) {
        return TABLE.getOrDefault(type, LOWEST);
    }

    public boolean isHigherThan(Precedence other) {
        return compareTo(other) > 0;
    }
}
