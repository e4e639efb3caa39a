package com.dynamoexpr.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Factory for creating ItemContext from JSON documents.
 * Nested objects and arrays are kept as nested maps and lists so that document paths
 * such as {@code address.city} or {@code tags[0]} can be resolved.
 */
public class ItemContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ItemContextFactory() {
    }

    /**
     * Create an ItemContext from a JSON item with no placeholders.
     *
     * @param itemJson JSON object holding the item attributes
     */
    public static ItemContext create(String itemJson) {
        return create(itemJson, null, null);
    }

    /**
     * Create an ItemContext from a JSON item and the expression's placeholders.
     *
     * @param itemJson   JSON object holding the item attributes
     * @param names      Attribute name placeholders (e.g. "#s" -> "status"), can be null
     * @param valuesJson JSON object of value placeholders (e.g. {":min": 10}), can be null
     */
    public static ItemContext create(String itemJson, Map<String, String> names, String valuesJson) {
        ItemContext.Builder builder = ItemContext.builder();

        if (itemJson != null && !itemJson.isBlank()) {
            builder.attributes(parseJson(itemJson, "item"));
        }
        if (names != null) {
            builder.attributeNames(names);
        }
        if (valuesJson != null && !valuesJson.isBlank()) {
            builder.attributeValues(parseJson(valuesJson, "attribute values"));
        }

        return builder.build();
    }

    private static Map<String, Object> parseJson(String json, String what) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
