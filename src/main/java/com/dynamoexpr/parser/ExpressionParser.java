package com.dynamoexpr.parser;

import com.dynamoexpr.ast.DynamoExpression;
import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.ast.ExpressionStatement;
import com.dynamoexpr.token.Token;
import com.dynamoexpr.token.TokenSource;
import com.dynamoexpr.token.TokenType;

import java.util.List;
import java.util.Optional;

/**
 * Pratt parser for condition expressions.
 * <p>
 * Each token type has a binding {@link Precedence} and, through {@link ParseRules}, a prefix
 * and/or infix parselet. {@link #parseExpression(Precedence)} applies the prefix parselet of the
 * current token, then keeps folding infix operators into the left operand while the lookahead
 * binds tighter than the caller's floor.
 * <p>
 * Errors do not abort the parse. They are recorded in {@link ParseDiagnostics} and the failed
 * construct resolves to null. Nesting deeper than {@link #MAX_DEPTH} is recorded as an error
 * and ends the parse. One instance parses one token source.
 */
public final class ExpressionParser {

    public static final int MAX_DEPTH = 256;

    private final TokenSource source;
    private final ParseRules rules;
    private final ParserOptions options;
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    private Token current;
    private Token lookahead;
    private int depth;

    public ExpressionParser(TokenSource source) {
        this(source, ParseRules.standard(), ParserOptions.defaults());
    }

    public ExpressionParser(TokenSource source, ParserOptions options) {
        this(source, ParseRules.standard(), options);
    }

    public ExpressionParser(TokenSource source, ParseRules rules, ParserOptions options) {
        this.source = source;
        this.rules = rules;
        this.options = options;

        // Prime current and lookahead
        advance();
        advance();
    }

    /**
     * Parse the whole token stream into a single-statement expression.
     *
     * @return Tree and the errors recorded while parsing it
     */
    public ParseResult parse() {
        Token start = current;
        ExpressionStatement statement = null;

        try {
            while (!current.is(TokenType.EOF)) {
                statement = parseExpressionStatement();

                if (!current.is(TokenType.EOF) && options.strictSingleStatement()) {
                    if (diagnostics.isEmpty()) {
                        diagnostics.unexpectedToken(TokenType.EOF, lookahead.type());
                    }
                    break;
                }

                advance();
            }
        } catch (NestingTooDeepException e) {
            // Keep a statement with no expression so the tree cannot be evaluated
            statement = new ExpressionStatement(start, null);
        }

        return new ParseResult(new DynamoExpression(statement), diagnostics.errors());
    }

    private ExpressionStatement parseExpressionStatement() {
        Token start = current;
        Expression expression = parseExpression(Precedence.LOWEST);

        if (lookaheadIs(TokenType.EOF)) {
            advance();
        }

        return new ExpressionStatement(start, expression);
    }

    /**
     * Parse an expression starting at the current token, consuming operators that bind
     * tighter than {@code minPrecedence}.
     *
     * @param minPrecedence Binding power the caller requires before an operator may continue
     * @return Parsed expression; null if no prefix parselet exists for the current token
     */
    public Expression parseExpression(Precedence minPrecedence) {
        if (depth == MAX_DEPTH) {
            diagnostics.nestingTooDeep(MAX_DEPTH);
            throw new NestingTooDeepException();
        }

        depth++;
        try {
            return parsePratt(minPrecedence);
        } finally {
            depth--;
        }
    }

    private Expression parsePratt(Precedence minPrecedence) {
        Optional<PrefixParselet> prefix = rules.prefix(current.type());
        if (prefix.isEmpty()) {
            diagnostics.noPrefixParselet(current.type());
            return null;
        }

        Expression left = prefix.get().parse(this);

        while (!lookaheadIs(TokenType.EOF) && lookaheadPrecedence().isHigherThan(minPrecedence)) {
            Optional<InfixParselet> infix = rules.infix(lookahead.type());
            if (infix.isEmpty()) {
                return left;
            }

            advance();
            left = infix.get().parse(this, left);
        }

        return left;
    }

    // Cursor operations used by parselets

    public Token current() {
        return current;
    }

    public Token lookahead() {
        return lookahead;
    }

    public void advance() {
        current = lookahead;
        lookahead = source.nextToken();
    }

    public boolean lookaheadIs(TokenType type) {
        return lookahead.is(type);
    }

    /**
     * Advance if the lookahead has the expected type, otherwise record an error.
     *
     * @return true if the parser advanced onto the expected token
     */
    public boolean expectLookahead(TokenType type) {
        if (!lookaheadIs(type)) {
            diagnostics.unexpectedToken(type, lookahead.type());
            return false;
        }
        advance();
        return true;
    }

    public Precedence currentPrecedence() {
        return Precedence.of(current.type());
    }

    public Precedence lookaheadPrecedence() {
        return Precedence.of(lookahead.type());
    }

    /**
     * Errors recorded so far, in order.
     */
    public List<String> errors() {
        return diagnostics.errors();
    }

    /**
     * Unwinds a parse that nested too deeply. The error is recorded before it is thrown.
     */
    private static final class NestingTooDeepException extends RuntimeException {

        NestingTooDeepException() {
            super(null, null, false, false);
        }
    }
}
