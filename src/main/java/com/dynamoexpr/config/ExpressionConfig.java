package com.dynamoexpr.config;

import com.dynamoexpr.parser.ParserOptions;

/**
 * Configuration for parsing condition expressions.
 *
 * @param strictSingleStatement  Reject tokens left after the first top-level expression
 * @param caseInsensitiveKeywords Accept AND/OR/NOT/BETWEEN in any letter case
 */
public record ExpressionConfig(
        boolean strictSingleStatement,
        boolean caseInsensitiveKeywords
) {
    /**
     * Configuration used when no file is supplied.
     */
    public static ExpressionConfig defaults() {
        return new ExpressionConfig(true, true);
    }

    public ParserOptions parserOptions() {
        return new ParserOptions(strictSingleStatement);
    }
}
