package com.dynamoexpr.parser;

import com.dynamoexpr.parser.parselet.BetweenParselet;
import com.dynamoexpr.parser.parselet.BinaryOperatorParselet;
import com.dynamoexpr.parser.parselet.CallParselet;
import com.dynamoexpr.parser.parselet.GroupParselet;
import com.dynamoexpr.parser.parselet.IdentifierParselet;
import com.dynamoexpr.parser.parselet.NotParselet;
import com.dynamoexpr.token.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of prefix and infix parselets keyed by token type.
 * Immutable once built; safe to share between parsers.
 */
public final class ParseRules {

    private static final ParseRules STANDARD = builder()
            .prefix(TokenType.IDENT, new IdentifierParselet())
            .prefix(TokenType.NOT, new NotParselet())
            .prefix(TokenType.LPAREN, new GroupParselet())
            .infix(TokenType.EQ, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.NOT_EQ, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.BETWEEN, new BetweenParselet())
            .infix(TokenType.LT, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.GT, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.LTE, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.GTE, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.AND, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.OR, BinaryOperatorParselet.INSTANCE)
            .infix(TokenType.LPAREN, new CallParselet())
            .build();

    private final Map<TokenType, PrefixParselet> prefixParselets;
    private final Map<TokenType, InfixParselet> infixParselets;

    private ParseRules(Map<TokenType, PrefixParselet> prefixParselets,
                       Map<TokenType, InfixParselet> infixParselets) {
        this.prefixParselets = prefixParselets;
        this.infixParselets = infixParselets;
    }

    /**
     * Rules for the condition expression grammar.
     */
    public static ParseRules standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-populated with the standard rules, for registering extra parselets.
     */
    public static Builder extend() {
        Builder builder = new Builder();
        builder.prefixParselets.putAll(STANDARD.prefixParselets);
        builder.infixParselets.putAll(STANDARD.infixParselets);
        return builder;
    }

    public Optional<PrefixParselet> prefix(TokenType type) {
        return Optional.ofNullable(prefixParselets.get(type));
    }

    public Optional<InfixParselet> infix(TokenType type) {
        return Optional.ofNullable(infixParselets.get(type));
    }

    public static final class Builder {
        private final Map<TokenType, PrefixParselet> prefixParselets = new EnumMap<>(TokenType.class);
        private final Map<TokenType, InfixParselet> infixParselets = new EnumMap<>(TokenType.class);

        private Builder() {
        }

        public Builder prefix(TokenType type, PrefixParselet parselet) {
            prefixParselets.put(type, parselet);
            return this;
        }

        public Builder infix(TokenType type, InfixParselet parselet) {
            infixParselets.put(type, parselet);
            return this;
        }

        public ParseRules build() {
            return new ParseRules(new EnumMap<>(prefixParselets), new EnumMap<>(infixParselets));
        }
    }
}
