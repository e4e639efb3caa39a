package com.dynamoexpr.eval;

import java.util.Map;
import java.util.Optional;

/**
 * Item an expression is evaluated against, together with the expression's placeholders.
 * Immutable after creation.
 */
public interface ItemContext {

    /**
     * Get a top-level attribute of the item.
     *
     * @param name Attribute name
     * @return Attribute value ({@link NullValue#INSTANCE} for an explicit null), or empty if absent
     */
    Optional<Object> getAttribute(String name);

    /**
     * Get all top-level attributes of the item.
     */
    Map<String, Object> getAttributes();

    /**
     * Resolve an expression attribute name placeholder.
     *
     * @param placeholder Placeholder including the '#' prefix (e.g. "#status")
     * @return Attribute name, or empty if the placeholder is not defined
     */
    Optional<String> getAttributeName(String placeholder);

    /**
     * Resolve an expression attribute value placeholder.
     *
     * @param placeholder Placeholder including the ':' prefix (e.g. ":min")
     * @return Bound value, or empty if the placeholder is not defined
     */
    Optional<Object> getAttributeValue(String placeholder);

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultItemContext.Builder();
    }

    /**
     * Builder for ItemContext.
     */
    interface Builder {
        Builder attribute(String name, Object value);

        Builder attributes(Map<String, Object> attributes);

        Builder attributeName(String placeholder, String name);

        Builder attributeNames(Map<String, String> names);

        Builder attributeValue(String placeholder, Object value);

        Builder attributeValues(Map<String, Object> values);

        ItemContext build();
    }
}
