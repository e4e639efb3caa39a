package com.dynamoexpr.token;

import java.util.Map;

/**
 * Keywords and operator symbols recognised by the tokenizer.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Keywords mapped to token types, keyed in upper case.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "BETWEEN", TokenType.BETWEEN
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char EQUALS = '=';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char MINUS = '-';
        public static final char UNDERSCORE = '_';
        public static final char COLON = ':';
        public static final char HASH = '#';

        private Operators() {
        }
    }

    /**
     * Prefix of expression attribute value placeholders (e.g. ":min").
     */
    public static final String VALUE_PLACEHOLDER_PREFIX = ":";

    /**
     * Prefix of expression attribute name placeholders (e.g. "#status").
     */
    public static final String NAME_PLACEHOLDER_PREFIX = "#";
}
