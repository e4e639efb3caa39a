package com.dynamoexpr.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.dynamoexpr.token.LexerConfig.*;

/**
 * Tokenizer for condition expressions.
 * Produces tokens on demand; unknown characters become {@link TokenType#ILLEGAL} tokens
 * so that the parser can report them instead of the tokenizer failing fast.
 * <p>
 * Quoted strings and numbers are returned as {@link TokenType#IDENT} tokens whose literal
 * is the raw source text (quotes included).
 */
public final class ExpressionTokenizer implements TokenSource {

    private final String input;
    private final int length;
    private final boolean caseInsensitiveKeywords;
    private int pos;

    public ExpressionTokenizer(String input) {
        this(input, true);
    }

    public ExpressionTokenizer(String input, boolean caseInsensitiveKeywords) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.caseInsensitiveKeywords = caseInsensitiveKeywords;
        this.pos = 0;
    }

    /**
     * Tokenize the whole input.
     *
     * @return List of tokens, terminated by a single EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    @Override
    public Token nextToken() {
        skipWhitespace();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", length);
        }

        int start = pos;
        char c = advance();

        return switch (c) {
            case Operators.LEFT_PAREN -> new Token(TokenType.LPAREN, "(", start);
            case Operators.RIGHT_PAREN -> new Token(TokenType.RPAREN, ")", start);
            case Operators.COMMA -> new Token(TokenType.COMMA, ",", start);
            case Operators.EQUALS -> new Token(TokenType.EQ, "=", start);
            case Operators.GREATER -> match(Operators.EQUALS)
                    ? new Token(TokenType.GTE, ">=", start)
                    : new Token(TokenType.GT, ">", start);
            case Operators.LESS -> {
                if (match(Operators.EQUALS)) {
                    yield new Token(TokenType.LTE, "<=", start);
                }
                if (match(Operators.GREATER)) {
                    yield new Token(TokenType.NOT_EQ, "<>", start);
                }
                yield new Token(TokenType.LT, "<", start);
            }
            case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> readString(start, c);
            default -> {
                if (isIdentifierStart(c)) {
                    yield readIdentifierOrKeyword(start);
                }
                if (isDigit(c) || (c == Operators.MINUS && !isAtEnd() && isDigit(peek()))) {
                    yield readNumber(start);
                }
                yield new Token(TokenType.ILLEGAL, String.valueOf(c), start);
            }
        };
    }

    private Token readIdentifierOrKeyword(int start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String key = caseInsensitiveKeywords ? text.toUpperCase(Locale.ROOT) : text;

        TokenType keywordType = KEYWORDS.get(key);
        if (keywordType != null) {
            return new Token(keywordType, text, start);
        }
        return new Token(TokenType.IDENT, text, start);
    }

    private Token readNumber(int start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        if (!isAtEnd() && peek() == Operators.DOT
                && pos + 1 < length && isDigit(input.charAt(pos + 1))) {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }

        return new Token(TokenType.IDENT, input.substring(start, pos), start);
    }

    private Token readString(int start, char quote) {
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == Operators.BACKSLASH && !isAtEnd()) {
                advance();
            }
        }

        if (isAtEnd()) {
            return new Token(TokenType.ILLEGAL, input.substring(start), start);
        }

        advance(); // closing quote
        return new Token(TokenType.IDENT, input.substring(start, pos), start);
    }

    // ASCII only; number literals are later read as BigDecimal
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c)
                || c == Operators.UNDERSCORE
                || c == Operators.COLON
                || c == Operators.HASH;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c)
                || c == Operators.UNDERSCORE
                || c == Operators.DOT
                || c == Operators.MINUS
                || c == Operators.LEFT_BRACKET
                || c == Operators.RIGHT_BRACKET
                || c == Operators.COLON
                || c == Operators.HASH;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
