package com.catalogmcp.shared.mcp.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObjectSchemaTest {

    private final ObjectSchema schema = ObjectSchema.builder()
        .required("entityRef", ScalarSchema.string("ref"))
        .optional("fields", ArraySchema.ofStrings("fields"))
        .optional("limit", ScalarSchema.integer("limit"))
        .build();

    @Nested
    @DisplayName("Introspection")
    class Introspection {

        @Test
        @DisplayName("Field names keep declaration order")
        void fieldNamesInDeclarationOrder() {
            assertTrue(schema.isIntrospectable());
            assertEquals(List.of("entityRef", "fields", "limit"), schema.fieldNames());
        }

        @Test
        @DisplayName("Non-object shapes are not introspectable")
        void scalarAndArrayAreOpaque() {
            assertFalse(ScalarSchema.string("x").isIntrospectable());
            assertTrue(ArraySchema.ofStrings("x").fieldNames().isEmpty());
            assertTrue(RawSchema.of(Map.of("type", "object")).fieldNames().isEmpty());
        }

        @Test
        @DisplayName("Declaring a field twice is rejected")
        void duplicateField() {
            ObjectSchema.Builder builder = ObjectSchema.builder().required("a", ScalarSchema.string("a"));
            assertThrows(IllegalArgumentException.class, () -> builder.optional("a", ScalarSchema.bool("a")));
        }
    }

    @Test
    @DisplayName("JSON schema lists properties and required fields")
    void rendersJsonSchema() {
        Map<String, Object> json = schema.toJsonSchema();

        assertEquals("object", json.get("type"));
        assertEquals(List.of("entityRef"), json.get("required"));
        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) json.get("properties");
        assertEquals(List.of("entityRef", "fields", "limit"), List.copyOf(properties.keySet()));
        assertEquals(Map.of("type", "array", "items", Map.of("type", "string"), "description", "fields"),
            properties.get("fields"));
    }

    @Nested
    @DisplayName("Argument validation")
    class Validation {

        @Test
        void acceptsConformingArguments() {
            assertTrue(schema.validate(Map.of("entityRef", "component:default/a", "limit", 5)).isEmpty());
        }

        @Test
        void reportsMissingRequiredField() {
            assertEquals(List.of("'entityRef' is required"), schema.validate(Map.of()));
        }

        @Test
        void reportsTypeMismatch() {
            List<String> violations = schema.validate(Map.of("entityRef", "x", "limit", "ten"));
            assertEquals(1, violations.size());
            assertTrue(violations.get(0).startsWith("'limit' does not match"));
        }

        @Test
        void toleratesUnknownFieldsAndNullArguments() {
            assertTrue(schema.validate(Map.of("entityRef", "x", "extra", true)).isEmpty());
            assertFalse(schema.validate(null).isEmpty());
        }
    }
}
