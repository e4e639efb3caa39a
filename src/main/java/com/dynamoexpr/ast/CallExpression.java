package com.dynamoexpr.ast;

import com.dynamoexpr.token.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Function call such as {@code size(attr)}.
 *
 * @param token     Opening parenthesis token
 * @param callee    Function expression, usually an {@link Identifier}
 * @param arguments Arguments in source order
 */
public record CallExpression(Token token, Expression callee, List<Expression> arguments) implements Expression {

    public CallExpression {
        // Unmodifiable view; a failed argument is kept as a null element.
        arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    /**
     * Callee name if the callee is a plain identifier, otherwise its rendered form.
     */
    public String functionName() {
        return callee instanceof Identifier identifier ? identifier.name() : String.valueOf(callee);
    }

    @Override
    public String toString() {
        return callee + "(" + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ")) + ")";
    }
}
