package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.mcpserver.mcp.error.ErrorFormat;
import com.catalogmcp.mcpserver.mcp.error.ToolErrorClassifier;
import com.catalogmcp.mcpserver.mcp.error.ToolErrorHandler;
import com.catalogmcp.mcpserver.mcp.error.ToolResponseFormatter;
import com.catalogmcp.mcpserver.mcp.execution.DirectExecutionStrategy;
import com.catalogmcp.mcpserver.mcp.middleware.ToolMiddlewarePipeline;
import com.catalogmcp.mcpserver.mcp.middleware.ValidationMiddleware;
import com.catalogmcp.mcpserver.support.StubTool;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import com.catalogmcp.shared.mcp.tools.ToolDispatchSurface;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class DefaultToolRegistrarTest {

    private static final ToolMetadata LOOKUP = ToolMetadata.builder()
        .name("get_entity_by_ref")
        .description("Fetch one entity")
        .parameterSchema(ObjectSchema.builder().required("entityRef", ScalarSchema.string("ref")).build())
        .build();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ToolRegistry registry;
    private DefaultToolRegistrar registrar;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        ToolMiddlewarePipeline pipeline = new ToolMiddlewarePipeline();
        pipeline.use(new ValidationMiddleware());
        ToolErrorHandler errorHandler = new ToolErrorHandler(new ToolErrorClassifier(), new ToolResponseFormatter(),
            objectMapper, ErrorFormat.STANDARD);
        ToolExecutionContext base = ToolExecutionContext.builder().server(registry).build();
        registrar = new DefaultToolRegistrar(registry, base, pipeline, new DirectExecutionStrategy(), errorHandler);
    }

    @Test
    void bindsSchemaAndDescription() {
        registrar.register(StubTool.echo(), LOOKUP);

        Map<String, Object> descriptor = registry.listTools().get(0);
        assertEquals("get_entity_by_ref", descriptor.get("name"));
        assertEquals("Fetch one entity", descriptor.get("description"));
        assertEquals(LOOKUP.getParameterSchema().toJsonSchema(), descriptor.get("inputSchema"));
    }

    @Test
    void parameterlessToolGetsEmptyObjectSchema() {
        registrar.register(StubTool.echo(), ToolMetadata.builder().name("ping").description("d").build());

        assertEquals(ObjectSchema.empty().toJsonSchema(), registry.listTools().get(0).get("inputSchema"));
    }

    @Test
    void callCarriesExtrasAndMetadataIntoContext() {
        StubTool tool = StubTool.echo();
        registrar.register(tool, LOOKUP);

        ToolResult result = registry.invoke("get_entity_by_ref",
            Map.of("entityRef", "component:default/a"), Map.of("requestId", "42")).join();

        assertFalse(result.isError());
        ToolExecutionContext context = tool.lastContext();
        assertEquals("42", context.getExtra("requestId"));
        assertSame(LOOKUP, context.getMetadata());
        assertSame(registry, context.getServer());
    }

    @Test
    void invalidArgumentsBecomeErrorResult() throws Exception {
        StubTool tool = StubTool.echo();
        registrar.register(tool, LOOKUP);

        ToolResult result = registry.invoke("get_entity_by_ref", Map.of(), Map.of()).join();

        assertTrue(result.isError());
        JsonNode payload = objectMapper.readTree(result.firstText());
        assertEquals("VALIDATION_ERROR", payload.path("data").path("code").asText());
        assertEquals(0, tool.invocationCount());
    }

    @Test
    void throwingToolBecomesErrorResult() {
        registrar.register(new StubTool(args -> {
            throw new IllegalStateException("backstage exploded");
        }), LOOKUP);

        ToolResult result = registry.invoke("get_entity_by_ref", Map.of("entityRef", "x"), Map.of()).join();

        assertTrue(result.isError());
        assertTrue(result.firstText().contains("backstage exploded"));
    }

    @Test
    void duplicateRegistrationPropagates() {
        registrar.register(StubTool.echo(), LOOKUP);

        assertThrows(IllegalStateException.class, () -> registrar.register(StubTool.echo(), LOOKUP));
    }

    @Test
    void surfaceFailureIsRethrown() {
        ToolDispatchSurface surface = mock(ToolDispatchSurface.class);
        doThrow(new IllegalArgumentException("rejected"))
            .when(surface).tool(anyString(), anyString(), anyMap(), any());
        DefaultToolRegistrar failing = new DefaultToolRegistrar(surface, ToolExecutionContext.builder().build(),
            new ToolMiddlewarePipeline(), new DirectExecutionStrategy(), null);

        IllegalArgumentException error =
            assertThrows(IllegalArgumentException.class, () -> failing.register(StubTool.echo(), LOOKUP));
        assertEquals("rejected", error.getMessage());
    }
}
