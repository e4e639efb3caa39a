package com.dynamoexpr.token;

/**
 * Token types for condition expressions.
 */
public enum TokenType {
    // Identifiers (attribute paths, placeholders, quoted strings and numbers)
    IDENT,

    // Comparison operators
    EQ,
    NOT_EQ,
    LT,
    GT,
    LTE,
    GTE,

    // Logical operators
    AND,
    OR,
    NOT,

    // Range
    BETWEEN,

    // Delimiters
    LPAREN,
    RPAREN,
    COMMA,

    // Special
    ILLEGAL,
    EOF
}
