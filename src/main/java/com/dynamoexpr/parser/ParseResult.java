package com.dynamoexpr.parser;

import com.dynamoexpr.ast.DynamoExpression;
import com.dynamoexpr.exception.ExpressionSyntaxException;

import java.util.List;

/**
 * Outcome of a parse: the tree and the errors recorded while building it.
 * A tree returned with errors may contain null subtrees and must not be evaluated.
 *
 * @param expression Root of the tree
 * @param errors     Diagnostics in the order they were recorded
 */
public record ParseResult(DynamoExpression expression, List<String> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Return the tree, or throw if the parse recorded errors.
     *
     * @param source Source text, used in the exception message
     */
    public DynamoExpression orThrow(String source) {
        if (hasErrors()) {
            throw new ExpressionSyntaxException(source, errors);
        }
        return expression;
    }
}
