package com.catalogmcp.shared.mcp.registry;

import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolMetadataRegistryTest {

    private ToolMetadataRegistry registry;

    static class FirstTool {
    }

    static class SecondTool {
    }

    @BeforeEach
    void setUp() {
        registry = new ToolMetadataRegistry();
    }

    @Test
    void lookupIsKeyedByClassIdentity() {
        ToolMetadata first = ToolMetadata.builder().name("same_name").description("first").build();
        ToolMetadata second = ToolMetadata.builder().name("same_name").description("second").build();

        registry.register(FirstTool.class, first);
        assertSame(second, registry.define(SecondTool.class, second));

        assertEquals(2, registry.size());
        assertSame(first, registry.lookup(FirstTool.class).orElseThrow());
        assertSame(second, registry.lookup(SecondTool.class).orElseThrow());
    }

    @Test
    void absentMetadataIsEmptyNotAnError() {
        assertTrue(registry.lookup(FirstTool.class).isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
        assertFalse(registry.contains(FirstTool.class));
    }

    @Test
    void clearRemovesEverything() {
        registry.register(FirstTool.class, ToolMetadata.builder().name("a").description("a").build());
        registry.clear();
        assertEquals(0, registry.size());
    }

    @Test
    void parameterNamesFollowObjectSchema() {
        ToolMetadata withObject = ToolMetadata.builder()
            .name("a")
            .description("a")
            .parameterSchema(ObjectSchema.builder()
                .required("zeta", ScalarSchema.string("z"))
                .optional("alpha", ScalarSchema.string("a"))
                .build())
            .build();
        ToolMetadata withScalar = withObject.toBuilder().parameterSchema(ScalarSchema.string("s")).build();
        ToolMetadata withoutSchema = withObject.toBuilder().parameterSchema(null).build();

        assertEquals(List.of("zeta", "alpha"), withObject.parameterNames());
        assertEquals(List.of(), withScalar.parameterNames());
        assertEquals(List.of(), withoutSchema.parameterNames());
    }

    @Test
    void batchingNeedsMoreThanOneSlot() {
        ToolMetadata base = ToolMetadata.builder().name("a").description("a").build();
        assertFalse(base.isBatchable());
        assertFalse(base.toBuilder().maxBatchSize(1).build().isBatchable());
        assertTrue(base.toBuilder().maxBatchSize(2).build().isBatchable());
    }
}
