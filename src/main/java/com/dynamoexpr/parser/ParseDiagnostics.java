package com.dynamoexpr.parser;

import com.dynamoexpr.token.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only list of errors recorded during a single parse.
 */
public final class ParseDiagnostics {

    private final List<String> errors = new ArrayList<>();

    void noPrefixParselet(TokenType type) {
        errors.add("no prefix parse function for " + type + " found");
    }

    void unexpectedToken(TokenType expected, TokenType actual) {
        errors.add("expected next token to be " + expected + ", got " + actual + " instead");
    }

    void nestingTooDeep(int maxDepth) {
        errors.add("expression nesting exceeds maximum depth of " + maxDepth);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    /**
     * Read-only view of the errors in the order they were recorded.
     */
    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }
}
