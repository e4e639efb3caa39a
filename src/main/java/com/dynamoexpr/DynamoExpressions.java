package com.dynamoexpr;

import com.dynamoexpr.ast.DynamoExpression;
import com.dynamoexpr.config.ExpressionConfig;
import com.dynamoexpr.parser.ExpressionParser;
import com.dynamoexpr.parser.ParseResult;
import com.dynamoexpr.parser.ParserOptions;
import com.dynamoexpr.token.ExpressionTokenizer;
import com.dynamoexpr.token.TokenSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade for parsing DynamoDB-style condition expressions.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: AND, OR, NOT</li>
 *   <li>Comparisons: =, &lt;&gt;, &lt;, &lt;=, &gt;, &gt;=</li>
 *   <li>Range: BETWEEN low AND high</li>
 *   <li>Function calls: size(attr), begins_with(attr, :v), ...</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: OR &lt; AND &lt; NOT &lt; equality &lt; BETWEEN &lt; relational &lt; call
 */
public final class DynamoExpressions {

    private static final Logger log = LoggerFactory.getLogger(DynamoExpressions.class);

    private DynamoExpressions() {
    }

    /**
     * Parse an expression with the default configuration.
     *
     * @param expression Expression string
     * @return Tree and recorded errors
     */
    public static ParseResult parse(String expression) {
        return parse(expression, ExpressionConfig.defaults());
    }

    /**
     * Parse an expression with the given configuration.
     */
    public static ParseResult parse(String expression, ExpressionConfig config) {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression, config.caseInsensitiveKeywords());
        ParseResult result = parse(tokenizer, config.parserOptions());
        if (result.hasErrors()) {
            log.debug("Parsed '{}' with {} error(s): {}", expression, result.errors().size(), result.errors());
        } else {
            log.debug("Parsed '{}' as {}", expression, result.expression());
        }
        return result;
    }

    /**
     * Parse tokens from an external token source.
     */
    public static ParseResult parse(TokenSource tokens) {
        return parse(tokens, ParserOptions.defaults());
    }

    public static ParseResult parse(TokenSource tokens, ParserOptions options) {
        return new ExpressionParser(tokens, options).parse();
    }

    /**
     * Parse an expression and throw if it is not well formed.
     *
     * @throws com.dynamoexpr.exception.ExpressionSyntaxException if errors were recorded
     */
    public static DynamoExpression parseOrThrow(String expression) {
        return parse(expression).orThrow(expression);
    }
}
