package com.dynamoexpr.eval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ItemContextFactory and DefaultItemContext.
 */
class ItemContextFactoryTest {

    @Test
    @DisplayName("Should keep nested documents and read floats as BigDecimal")
    void shouldParseNestedItem() {
        ItemContext context = ItemContextFactory.create("""
                {"price": 19.99, "qty": 3, "dims": {"w": 2}, "tags": ["a", null]}
                """);

        assertEquals(new BigDecimal("19.99"), context.getAttribute("price").orElseThrow());
        assertEquals(3, context.getAttribute("qty").orElseThrow());
        assertEquals(Map.of("w", 2), context.getAttribute("dims").orElseThrow());
        assertEquals(List.of("a", NullValue.INSTANCE), context.getAttribute("tags").orElseThrow());
        assertTrue(context.getAttribute("missing").isEmpty());
    }

    @Test
    @DisplayName("Should register name and value placeholders")
    void shouldRegisterPlaceholders() {
        ItemContext context = ItemContextFactory.create("{}", Map.of("#n", "name"), "{\":v\": \"x\"}");

        assertEquals("name", context.getAttributeName("#n").orElseThrow());
        assertEquals("x", context.getAttributeValue(":v").orElseThrow());
        assertTrue(context.getAttributeValue(":w").isEmpty());
    }

    @Test
    @DisplayName("Should accept null and blank inputs")
    void shouldAcceptMissingInputs() {
        ItemContext context = ItemContextFactory.create(null, null, " ");

        assertTrue(context.getAttributes().isEmpty());
    }

    @Test
    @DisplayName("Should reject invalid JSON")
    void shouldRejectInvalidJson() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ItemContextFactory.create("{not json"));

        assertTrue(e.getMessage().startsWith("Invalid JSON item"));
    }

    @Test
    @DisplayName("Built context is immutable")
    void shouldBeImmutable() {
        ItemContext context = ItemContext.builder()
                .attribute("a", 1)
                .attributeValue(":v", null)
                .build();

        assertEquals(NullValue.INSTANCE, context.getAttributeValue(":v").orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> context.getAttributes().put("b", 2));
    }
}
