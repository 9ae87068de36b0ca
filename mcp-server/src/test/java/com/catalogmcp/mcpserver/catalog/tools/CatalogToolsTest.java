package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.errors.ConfigurationException;
import com.catalogmcp.shared.mcp.errors.NotFoundException;
import com.catalogmcp.shared.mcp.errors.ToolExecutionException;
import com.catalogmcp.shared.mcp.errors.ValidationException;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CatalogToolsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CatalogClient catalog;
    private ToolExecutionContext context;

    @BeforeEach
    void setUp() {
        catalog = mock(CatalogClient.class);
        context = ToolExecutionContext.builder().catalogClient(catalog).build();
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private static Throwable failureOf(CompletableFuture<ToolResult> future) {
        return assertThrows(CompletionException.class, future::join).getCause();
    }

    private ToolResult run(McpTool tool, Map<String, Object> arguments) {
        return tool.execute(arguments, context).join();
    }

    @Nested
    @DisplayName("read tools")
    class ReadTools {

        @Test
        @DisplayName("get_entities summarises the item count")
        void getEntitiesSummary() throws Exception {
            when(catalog.getEntities(any(), any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(json("[{\"kind\":\"Component\"},{\"kind\":\"API\"}]")));

            ToolResult result = run(new GetEntitiesTool(),
                Map.of("filter", List.of("kind=component"), "limit", 10));

            assertEquals("Found 2 entities", result.firstText());
            assertEquals(2, result.getContent().size());
            verify(catalog).getEntities(List.of("kind=component"), List.of(), 10, null);
        }

        @Test
        @DisplayName("get_entity_by_ref normalises compound references")
        void getEntityByRefCompound() throws Exception {
            when(catalog.getEntityByRef(anyString()))
                .thenReturn(CompletableFuture.completedFuture(json("{\"metadata\":{\"name\":\"web\"}}")));

            ToolResult result = run(new GetEntityByRefTool(),
                Map.of("entityRef", Map.of("kind", "Component", "name", "web")));

            verify(catalog).getEntityByRef("component:default/web");
            assertEquals("web", objectMapper.readTree(result.firstText()).path("metadata").path("name").asText());
        }

        @Test
        @DisplayName("output is rendered with the injected mapper")
        void outputUsesInjectedMapper() throws Exception {
            when(catalog.getEntityByRef(anyString()))
                .thenReturn(CompletableFuture.completedFuture(json("{\"metadata\":{\"name\":\"web\"}}")));
            ObjectMapper compact = new ObjectMapper();
            compact.setDefaultPrettyPrinter(new MinimalPrettyPrinter());
            GetEntityByRefTool tool = new GetEntityByRefTool();

            String defaultText = run(tool, Map.of("entityRef", "component:web")).firstText();
            tool.setObjectMapper(compact);
            String compactText = run(tool, Map.of("entityRef", "component:web")).firstText();

            assertTrue(defaultText.contains("\n"));
            assertEquals("{\"metadata\":{\"name\":\"web\"}}", compactText);
        }

        @Test
        @DisplayName("get_entities_by_refs counts resolved entries")
        void getEntitiesByRefs() throws Exception {
            when(catalog.getEntitiesByRefs(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(json("{\"items\":[{\"kind\":\"API\"},null]}")));

            ToolResult result = run(new GetEntitiesByRefsTool(),
                Map.of("entityRefs", List.of("api:orders", "component:default/gone")));

            assertEquals("Resolved 1 of 2 entity refs", result.firstText());
            verify(catalog).getEntitiesByRefs(List.of("api:default/orders", "component:default/gone"), List.of());
        }

        @Test
        @DisplayName("catalog failures surface unchanged")
        void catalogFailurePropagates() {
            when(catalog.getEntityByRef(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new NotFoundException("Entity component:default/x")));

            Throwable error = failureOf(new GetEntityByRefTool().execute(Map.of("entityRef", "component:x"), context));

            assertInstanceOf(NotFoundException.class, error);
        }
    }

    @Nested
    @DisplayName("write tools")
    class WriteTools {

        @Test
        void addLocationDryRun() throws Exception {
            when(catalog.addLocation(anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(json("{\"entities\":[]}")));

            ToolResult result = run(new AddLocationTool(),
                Map.of("type", "url", "target", "https://git/catalog-info.yaml", "dryRun", true));

            assertEquals("Validated location url:https://git/catalog-info.yaml", result.firstText());
            verify(catalog).addLocation("url", "https://git/catalog-info.yaml", true);
        }

        @Test
        void removeLocation() {
            when(catalog.removeLocationById("loc-1"))
                .thenReturn(CompletableFuture.completedFuture(NullNode.getInstance()));

            ToolResult result = run(new RemoveLocationByIdTool(), Map.of("locationId", "loc-1", "confirm", true));

            assertEquals("Removed location loc-1", result.firstText());
        }

        @Test
        void removeEntityRejectsMalformedUid() {
            Throwable error = failureOf(new RemoveEntityByUidTool().execute(Map.of("uid", "not-a-uuid"), context));

            assertInstanceOf(ValidationException.class, error);
            assertEquals("'uid' must be a UUID", error.getMessage());
            verifyNoInteractions(catalog);
        }

        @Test
        void removeEntityByUid() {
            String uid = "1b4e28ba-2fa1-11d2-883f-0016d3cca427";
            when(catalog.removeEntityByUid(uid)).thenReturn(CompletableFuture.completedFuture(NullNode.getInstance()));

            ToolResult result = run(new RemoveEntityByUidTool(), Map.of("uid", uid, "confirm", true));

            assertEquals("Removed entity " + uid, result.firstText());
        }

        @Test
        void refreshUsesCanonicalRef() {
            when(catalog.refreshEntity(anyString())).thenReturn(CompletableFuture.completedFuture(NullNode.getInstance()));

            ToolResult result = run(new RefreshEntityTool(), Map.of("entityRef", "Component:Default/web"));

            assertEquals("Refresh scheduled for component:default/web", result.firstText());
        }

        @Test
        void validateEntitySendsEntityAsJson() throws Exception {
            when(catalog.validateEntity(any(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(json("{\"valid\":false,\"errors\":[]}")));

            ToolResult result = run(new ValidateEntityTool(), Map.of(
                "entity", Map.of("kind", "Component", "metadata", Map.of("name", "web")),
                "locationRef", "url:https://git/catalog-info.yaml"));

            ArgumentCaptor<JsonNode> entity = ArgumentCaptor.forClass(JsonNode.class);
            verify(catalog).validateEntity(entity.capture(), eq("url:https://git/catalog-info.yaml"));
            assertEquals("web", entity.getValue().path("metadata").path("name").asText());
            assertEquals("Entity is invalid", result.firstText());
        }
    }

    @Nested
    @DisplayName("argument handling")
    class Arguments {

        @Test
        void wrongArgumentTypeIsValidationError() {
            Throwable error = failureOf(new GetEntitiesTool().execute(Map.of("limit", "ten"), context));

            assertInstanceOf(ValidationException.class, error);
            assertEquals("'limit' must be an integer", error.getMessage());
        }

        @Test
        void unexpectedRuntimeFailureIsWrapped() {
            when(catalog.getEntityFacets(any(), any())).thenThrow(new IllegalStateException("pool closed"));

            Throwable error = failureOf(new GetEntityFacetsTool().execute(Map.of("facets", List.of("kind")), context));

            assertInstanceOf(ToolExecutionException.class, error);
            assertInstanceOf(IllegalStateException.class, error.getCause());
        }

        @Test
        void missingCatalogClientIsConfigurationError() {
            ToolExecutionContext bare = ToolExecutionContext.builder().build();

            Throwable error = failureOf(new GetEntitiesTool().execute(Map.of(), bare));

            assertInstanceOf(ConfigurationException.class, error);
        }
    }
}
