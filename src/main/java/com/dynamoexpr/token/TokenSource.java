package com.dynamoexpr.token;

/**
 * Supplier of tokens for the parser.
 * <p>
 * Once the input is exhausted, every further call must return an {@link TokenType#EOF} token.
 */
@FunctionalInterface
public interface TokenSource {

    /**
     * Pull the next token from the stream.
     *
     * @return Next token, never null
     */
    Token nextToken();
}
