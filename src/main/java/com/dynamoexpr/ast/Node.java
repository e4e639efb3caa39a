package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

/**
 * Node of the expression syntax tree.
 * <p>
 * {@code toString()} renders a fully parenthesised canonical form of the subtree.
 */
public interface Node {

    /**
     * Token the node was built from.
     */
    Token token();

    /**
     * Raw literal of the originating token.
     */
    default String tokenLiteral() {
        return token() == null ? "" : token().literal();
    }
}
