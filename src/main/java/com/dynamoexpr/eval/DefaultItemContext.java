package com.dynamoexpr.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of ItemContext.
 * Immutable after construction; explicit nulls are stored as {@link NullValue#INSTANCE}.
 */
public final class DefaultItemContext implements ItemContext {

    private final Map<String, Object> attributes;
    private final Map<String, String> attributeNames;
    private final Map<String, Object> attributeValues;

    private DefaultItemContext(Builder builder) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.attributeNames = Collections.unmodifiableMap(new HashMap<>(builder.attributeNames));
        this.attributeValues = Collections.unmodifiableMap(new HashMap<>(builder.attributeValues));
    }

    @Override
    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Optional<String> getAttributeName(String placeholder) {
        return Optional.ofNullable(attributeNames.get(placeholder));
    }

    @Override
    public Optional<Object> getAttributeValue(String placeholder) {
        return Optional.ofNullable(attributeValues.get(placeholder));
    }

    @Override
    public String toString() {
        return "ItemContext{" +
                "attributes=" + attributes +
                ", attributeNames=" + attributeNames +
                ", attributeValues=" + attributeValues +
                '}';
    }

    @SuppressWarnings("unchecked")
    private static Object normalize(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) map).forEach((k, v) -> copy.put(k, normalize(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(normalize(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Builder for DefaultItemContext.
     */
    public static class Builder implements ItemContext.Builder {
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, String> attributeNames = new HashMap<>();
        private final Map<String, Object> attributeValues = new HashMap<>();

        @Override
        public Builder attribute(String name, Object value) {
            if (name != null) {
                this.attributes.put(name, normalize(value));
            }
            return this;
        }

        @Override
        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        @Override
        public Builder attributeName(String placeholder, String name) {
            if (placeholder != null && name != null) {
                this.attributeNames.put(placeholder, name);
            }
            return this;
        }

        @Override
        public Builder attributeNames(Map<String, String> names) {
            if (names != null) {
                names.forEach(this::attributeName);
            }
            return this;
        }

        @Override
        public Builder attributeValue(String placeholder, Object value) {
            if (placeholder != null) {
                this.attributeValues.put(placeholder, normalize(value));
            }
            return this;
        }

        @Override
        public Builder attributeValues(Map<String, Object> values) {
            if (values != null) {
                values.forEach(this::attributeValue);
            }
            return this;
        }

        @Override
        public ItemContext build() {
            return new DefaultItemContext(this);
        }
    }
}
