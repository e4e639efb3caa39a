package com.dynamoexpr.parser;

/**
 * Parser behaviour switches.
 *
 * @param strictSingleStatement When true, tokens left after the first statement end the parse
 *                              with an error. When false, parsing restarts on them and the last
 *                              statement parsed replaces earlier ones.
 */
public record ParserOptions(boolean strictSingleStatement) {

    public static ParserOptions defaults() {
        return new ParserOptions(true);
    }

    public static ParserOptions lenient() {
        return new ParserOptions(false);
    }
}
