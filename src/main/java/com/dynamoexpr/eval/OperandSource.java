package com.dynamoexpr.eval;

import static com.dynamoexpr.token.LexerConfig.NAME_PLACEHOLDER_PREFIX;
import static com.dynamoexpr.token.LexerConfig.VALUE_PLACEHOLDER_PREFIX;

import java.util.regex.Pattern;

/**
 * Where an identifier's value comes from.
 */
public enum OperandSource {
    /**
     * Quoted string literal ("x" or 'x')
     */
    STRING_LITERAL,

    /**
     * Number literal (5, -1.25)
     */
    NUMBER_LITERAL,

    /**
     * Expression attribute value placeholder (:name)
     */
    VALUE_PLACEHOLDER,

    /**
     * Document path into the item (a.b[0], #n.c)
     */
    ATTRIBUTE_PATH;

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    /**
     * Determine the source from an identifier name.
     *
     * @param reference Identifier text as written in the expression
     * @return The operand source
     * @throws IllegalArgumentException if reference is null or empty
     */
    public static OperandSource fromReference(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new IllegalArgumentException("Operand reference cannot be null or empty");
        }
        char first = reference.charAt(0);
        if (first == '"' || first == '\'') {
            return STRING_LITERAL;
        }
        if (reference.startsWith(VALUE_PLACEHOLDER_PREFIX)) {
            return VALUE_PLACEHOLDER;
        }
        if (NUMBER.matcher(reference).matches()) {
            return NUMBER_LITERAL;
        }
        return ATTRIBUTE_PATH;
    }

    /**
     * Whether a path segment is a name placeholder that must be substituted.
     */
    static boolean isNamePlaceholder(String segment) {
        return segment.startsWith(NAME_PLACEHOLDER_PREFIX);
    }
}
