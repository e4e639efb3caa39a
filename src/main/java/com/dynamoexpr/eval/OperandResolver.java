package com.dynamoexpr.eval;

import java.util.Optional;

/**
 * Resolves identifier operands against an item.
 */
public interface OperandResolver {

    /**
     * Resolve an identifier.
     *
     * @param reference Identifier text (e.g. "price", "#s", ":min", "\"GOLD\"", "10")
     * @param context   Item and placeholders
     * @return Resolved value, or empty if the path does not exist in the item
     */
    Optional<Object> resolve(String reference, ItemContext context);

    /**
     * Resolve an identifier as a string.
     *
     * @return String value, or empty if missing or not a string
     */
    default Optional<String> resolveAsString(String reference, ItemContext context) {
        return resolve(reference, context)
                .filter(String.class::isInstance)
                .map(String.class::cast);
    }
}
