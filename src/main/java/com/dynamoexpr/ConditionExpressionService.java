package com.dynamoexpr;

import com.dynamoexpr.ast.DynamoExpression;
import com.dynamoexpr.config.ExpressionConfig;
import com.dynamoexpr.eval.ExpressionEvaluator;
import com.dynamoexpr.eval.ItemContext;
import com.dynamoexpr.eval.ItemContextFactory;
import com.dynamoexpr.exception.ExpressionSyntaxException;
import com.dynamoexpr.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Parses condition expressions with a fixed configuration and evaluates them against items.
 * Thread-safe: every call uses its own parser.
 */
public class ConditionExpressionService {

    private static final Logger log = LoggerFactory.getLogger(ConditionExpressionService.class);

    private final ExpressionConfig config;
    private final ExpressionEvaluator evaluator;

    public ConditionExpressionService(ExpressionConfig config) {
        this(config, new ExpressionEvaluator());
    }

    public ConditionExpressionService(ExpressionConfig config, ExpressionEvaluator evaluator) {
        this.config = config;
        this.evaluator = evaluator;
    }

    /**
     * Parse an expression.
     *
     * @throws ExpressionSyntaxException if the parser recorded errors
     */
    public DynamoExpression parse(String expression) {
        ParseResult result = DynamoExpressions.parse(expression, config);
        if (result.hasErrors()) {
            log.warn("Rejected condition expression '{}': {}", expression, result.errors());
        }
        return result.orThrow(expression);
    }

    /**
     * Parse an expression and evaluate it against an item.
     */
    public boolean matches(String expression, ItemContext item) {
        return evaluator.evaluate(parse(expression), item);
    }

    /**
     * Parse an expression and evaluate it against a JSON item.
     *
     * @param expression Condition expression
     * @param itemJson   JSON object holding the item attributes
     * @param names      Attribute name placeholders, can be null
     * @param valuesJson JSON object of value placeholders, can be null
     */
    public boolean matches(String expression, String itemJson, Map<String, String> names, String valuesJson) {
        return matches(expression, ItemContextFactory.create(itemJson, names, valuesJson));
    }

    public ExpressionConfig getConfig() {
        return config;
    }
}
