package com.dynamoexpr.parser;

import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.ast.InfixExpression;
import com.dynamoexpr.ast.PrefixExpression;
import com.dynamoexpr.token.ExpressionTokenizer;
import com.dynamoexpr.token.Token;
import com.dynamoexpr.token.TokenSource;
import com.dynamoexpr.token.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for diagnostics recorded by ExpressionParser.
 */
class ExpressionParserErrorTest {

    private static ParseResult parse(String input) {
        return new ExpressionParser(new ExpressionTokenizer(input)).parse();
    }

    private static ParseResult parseLenient(String input) {
        return new ExpressionParser(new ExpressionTokenizer(input), ParserOptions.lenient()).parse();
    }

    @Test
    @DisplayName("Bare comma has no prefix parse function")
    void bareComma() {
        ParseResult result = parse(",");

        assertEquals(List.of("no prefix parse function for COMMA found"), result.errors());
        assertFalse(result.expression().isEmpty());
        assertTrue(result.expression().expression().isEmpty());
    }

    @Test
    @DisplayName("Missing AND in BETWEEN records exactly one error")
    void betweenWithoutAnd() {
        ParseResult result = parse("attr BETWEEN lo hi");

        assertEquals(List.of("expected next token to be AND, got IDENT instead"), result.errors());
        assertTrue(result.expression().expression().isEmpty());
    }

    @Test
    @DisplayName("BETWEEN bounds must be identifiers")
    void betweenBoundNotIdentifier() {
        ParseResult result = parse("attr BETWEEN (lo) AND hi");

        assertEquals("expected next token to be IDENT, got LPAREN instead", result.errors().get(0));
        assertEquals(1, result.errors().size());
    }

    @Test
    @DisplayName("BETWEEN without a high bound")
    void betweenWithoutHighBound() {
        ParseResult result = parse("attr BETWEEN lo AND");

        assertEquals(List.of("expected next token to be IDENT, got EOF instead"), result.errors());
    }

    @Test
    @DisplayName("Unclosed group records one error expecting RPAREN")
    void unclosedGroup() {
        ParseResult result = parse("(a = 1");

        assertEquals(List.of("expected next token to be RPAREN, got EOF instead"), result.errors());
        assertTrue(result.expression().expression().isEmpty());
    }

    @Test
    @DisplayName("Unclosed call records one error and drops the call")
    void unclosedCall() {
        ParseResult result = parse("size(attr > 3");

        assertEquals(List.of("expected next token to be RPAREN, got EOF instead"), result.errors());
        assertTrue(result.expression().expression().isEmpty());
    }

    @Test
    @DisplayName("Failed operand poisons its parent but keeps the node")
    void missingRightOperand() {
        ParseResult result = parse("a = )");

        assertEquals(List.of("no prefix parse function for RPAREN found"), result.errors());
        InfixExpression infix = assertInstanceOf(InfixExpression.class,
                result.expression().expression().orElseThrow());
        assertNull(infix.right());
    }

    @Test
    @DisplayName("NOT without operand")
    void notWithoutOperand() {
        ParseResult result = parse("NOT");

        assertEquals(List.of("no prefix parse function for EOF found"), result.errors());
        PrefixExpression not = assertInstanceOf(PrefixExpression.class,
                result.expression().expression().orElseThrow());
        assertNull(not.operand());
    }

    @Test
    @DisplayName("Illegal characters surface as missing prefix errors")
    void illegalCharacter() {
        ParseResult result = parse("a = !");

        assertEquals(List.of("no prefix parse function for ILLEGAL found"), result.errors());
    }

    @Test
    @DisplayName("Errors from independent call arguments accumulate in order")
    void multipleErrors() {
        ParseResult result = parse("f(=, <)");

        assertEquals(List.of(
                "no prefix parse function for EQ found",
                "no prefix parse function for LT found"), result.errors());
    }

    @Test
    @DisplayName("Deep nesting is recorded as one error instead of overflowing the stack")
    void nestingTooDeep() {
        String message = "expression nesting exceeds maximum depth of " + ExpressionParser.MAX_DEPTH;

        ParseResult groups = parse("(".repeat(3000) + "a = 1" + ")".repeat(3000));
        assertEquals(List.of(message), groups.errors());
        assertFalse(groups.expression().isEmpty());
        assertTrue(groups.expression().expression().isEmpty());

        ParseResult nots = parse("NOT ".repeat(3000) + "a");
        assertEquals(List.of(message), nots.errors());
    }

    @Test
    @DisplayName("Nesting below the limit parses normally")
    void nestingWithinLimit() {
        ParseResult result = parse("(".repeat(200) + "a = 1" + ")".repeat(200));

        assertFalse(result.hasErrors());
        assertEquals("(a = 1)", result.expression().toString());
    }

    // =====================================================================
    // Trailing tokens
    // =====================================================================

    @Test
    @DisplayName("Strict mode rejects tokens after the expression")
    void strictTrailingTokens() {
        ParseResult result = parse("a = b c = d");

        assertEquals(List.of("expected next token to be EOF, got IDENT instead"), result.errors());
        assertEquals("(a = b)", result.expression().toString());
    }

    @Test
    @DisplayName("Strict mode rejects a stray closing parenthesis")
    void strictStrayParen() {
        ParseResult result = parse("a = b)");

        assertEquals(List.of("expected next token to be EOF, got RPAREN instead"), result.errors());
    }

    @Test
    @DisplayName("Lenient mode keeps the last statement")
    void lenientLastStatementWins() {
        ParseResult result = parseLenient("a = b c = d");

        assertFalse(result.hasErrors());
        assertEquals("(c = d)", result.expression().toString());
    }

    @Test
    @DisplayName("Lenient mode overwrites a failed BETWEEN with the trailing identifier")
    void lenientAfterError() {
        ParseResult result = parseLenient("attr BETWEEN lo hi");

        assertEquals(1, result.errors().size());
        Expression expression = result.expression().expression().orElseThrow();
        assertEquals("hi", expression.toString());
    }

    // =====================================================================
    // Token source contract
    // =====================================================================

    @Test
    @DisplayName("Parser works on any token source")
    void customTokenSource() {
        Iterator<Token> tokens = List.of(
                new Token(TokenType.IDENT, "a", 0),
                new Token(TokenType.GTE, ">=", 2),
                new Token(TokenType.IDENT, ":v", 5)).iterator();
        TokenSource source = () -> tokens.hasNext() ? tokens.next() : new Token(TokenType.EOF, "", 7);

        ParseResult result = new ExpressionParser(source).parse();

        assertFalse(result.hasErrors());
        assertEquals("(a >= :v)", result.expression().toString());
    }

    @Test
    @DisplayName("Errors are available from the parser after parsing")
    void parserErrors() {
        ExpressionParser parser = new ExpressionParser(new ExpressionTokenizer(","));
        ParseResult result = parser.parse();

        assertEquals(result.errors(), parser.errors());
        assertThrows(UnsupportedOperationException.class, () -> parser.errors().add("x"));
    }
}
