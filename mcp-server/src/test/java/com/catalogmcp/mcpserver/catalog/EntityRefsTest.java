package com.catalogmcp.mcpserver.catalog;

import com.catalogmcp.shared.mcp.errors.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntityRefsTest {

    @Nested
    @DisplayName("string references")
    class StringRefs {

        @Test
        void fullReference() {
            assertEquals(new EntityRef("Component", "payments", "checkout-api"),
                EntityRefs.parse("Component:payments/checkout-api"));
        }

        @Test
        @DisplayName("namespace defaults when omitted")
        void defaultNamespace() {
            assertEquals("component:default/checkout-api", EntityRefs.toRefString("component:checkout-api"));
        }

        @Test
        @DisplayName("canonical form lower-cases kind and namespace only")
        void canonicalCasing() {
            assertEquals("group:platform/Core-Team", EntityRefs.toRefString(" Group:Platform/Core-Team "));
        }

        @Test
        void missingKindIsRejected() {
            ValidationException error = assertThrows(ValidationException.class, () -> EntityRefs.parse("checkout-api"));

            assertEquals("Invalid entity reference 'checkout-api': missing kind", error.getMessage());
        }

        @Test
        void malformedPartsAreRejected() {
            assertThrows(ValidationException.class, () -> EntityRefs.parse(":x"));
            assertThrows(ValidationException.class, () -> EntityRefs.parse("component:/x"));
            assertThrows(ValidationException.class, () -> EntityRefs.parse("component:default/"));
            assertThrows(ValidationException.class, () -> EntityRefs.parse("component:a/b/c"));
        }
    }

    @Nested
    @DisplayName("compound references")
    class CompoundRefs {

        @Test
        void fullCompound() {
            assertEquals("api:payments/orders",
                EntityRefs.toRefString(Map.of("kind", "API", "namespace", "payments", "name", "orders")));
        }

        @Test
        void namespaceDefaults() {
            assertEquals("component:default/web", EntityRefs.toRefString(Map.of("kind", "component", "name", "web")));
        }

        @Test
        void missingPartsAreRejected() {
            assertThrows(ValidationException.class, () -> EntityRefs.parse(Map.of("name", "web")));
            assertThrows(ValidationException.class, () -> EntityRefs.parse(Map.of("kind", "component")));
        }
    }

    @Test
    void otherShapesAreRejected() {
        assertThrows(ValidationException.class, () -> EntityRefs.parse(42));
        assertThrows(ValidationException.class, () -> EntityRefs.parse(List.of("component:default/a")));
        assertThrows(ValidationException.class, () -> EntityRefs.parse(null));
    }
}
