package com.dynamoexpr;

import com.dynamoexpr.ast.DynamoExpression;
import com.dynamoexpr.config.ExpressionConfig;
import com.dynamoexpr.exception.ExpressionSyntaxException;
import com.dynamoexpr.parser.ParseResult;
import com.dynamoexpr.parser.ParserOptions;
import com.dynamoexpr.token.ExpressionTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the DynamoExpressions facade.
 */
class DynamoExpressionsTest {

    @Test
    @DisplayName("Should parse a realistic filter expression")
    void shouldParseFilter() {
        DynamoExpression expression = DynamoExpressions.parseOrThrow(
                "attribute_exists(#s) AND (price BETWEEN :lo AND :hi OR begins_with(sku, :p)) AND NOT size(tags) < 1");

        assertEquals("((attribute_exists(#s) AND ((price BETWEEN :lo AND :hi) OR begins_with(sku, :p)))"
                + " AND (NOT (size(tags) < 1)))", expression.toString());
    }

    @Test
    @DisplayName("Should throw with all diagnostics")
    void shouldThrowOnErrors() {
        ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                () -> DynamoExpressions.parseOrThrow("(a = 1"));

        assertEquals("(a = 1", e.getExpression());
        assertEquals(List.of("expected next token to be RPAREN, got EOF instead"), e.getErrors());
        assertTrue(e.getMessage().contains("(a = 1"));
    }

    @Test
    @DisplayName("Should honour configuration")
    void shouldHonourConfig() {
        ExpressionConfig lenient = new ExpressionConfig(false, false);

        ParseResult result = DynamoExpressions.parse("a = b and c = d", lenient);

        // 'and' is an identifier when keywords are case sensitive; lenient mode keeps the last statement
        assertFalse(result.hasErrors());
        assertEquals("(c = d)", result.expression().toString());

        ParseResult strict = DynamoExpressions.parse("a = b and c = d");
        assertFalse(strict.hasErrors());
        assertEquals("((a = b) and (c = d))", strict.expression().toString());
    }

    @Test
    @DisplayName("Should parse from an external token source")
    void shouldParseTokenSource() {
        ParseResult result = DynamoExpressions.parse(new ExpressionTokenizer("x <> y"), ParserOptions.defaults());

        assertFalse(result.hasErrors());
        assertEquals("(x <> y)", result.expression().toString());
        assertEquals("(x <> y)", DynamoExpressions.parse(new ExpressionTokenizer("x <> y")).expression().toString());
    }
}
