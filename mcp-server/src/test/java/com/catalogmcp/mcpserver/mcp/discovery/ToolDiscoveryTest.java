package com.catalogmcp.mcpserver.mcp.discovery;

import com.catalogmcp.mcpserver.catalog.tools.GetEntityByRefTool;
import com.catalogmcp.mcpserver.catalog.tools.RemoveEntityByUidTool;
import com.catalogmcp.mcpserver.mcp.registry.RegistryToolMetadataProvider;
import com.catalogmcp.mcpserver.support.StubTool;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ToolDiscoveryTest {

    private static final String TOOLS_PACKAGE = "com.catalogmcp.mcpserver.catalog.tools";

    @Nested
    @DisplayName("static discovery")
    class Static {

        @Test
        @DisplayName("keeps only tool instances, in the given order")
        void filtersToTools() {
            StubTool first = StubTool.echo();
            StubTool second = StubTool.echo();

            List<ToolCandidate> candidates =
                new StaticToolDiscovery(List.of(first, 42, "text", second)).discover();

            assertEquals(2, candidates.size());
            assertSame(first, candidates.get(0).getTool());
            assertSame(second, candidates.get(1).getTool());
            assertEquals(StubTool.class.getName(), candidates.get(0).getSourceLabel());
        }
    }

    @Nested
    @DisplayName("classpath discovery")
    class Classpath {

        @Test
        @DisplayName("finds every concrete catalog tool sorted by class name")
        void findsCatalogTools() {
            List<ToolCandidate> candidates = new ClasspathToolDiscovery(TOOLS_PACKAGE, "Tool").discover();

            List<String> labels = candidates.stream().map(ToolCandidate::getSourceLabel).collect(Collectors.toList());
            assertEquals(13, candidates.size());
            assertEquals(labels.stream().sorted().collect(Collectors.toList()), labels);
            assertTrue(labels.contains(GetEntityByRefTool.class.getName()));
            assertFalse(labels.stream().anyMatch(label -> label.endsWith("AbstractCatalogTool")));
        }

        @Test
        @DisplayName("initialising the classes attaches their metadata")
        void loadedClassesCarryMetadata() {
            RegistryToolMetadataProvider provider =
                new RegistryToolMetadataProvider(ToolMetadataRegistry.getInstance());

            List<ToolCandidate> candidates = new ClasspathToolDiscovery(TOOLS_PACKAGE, null).discover();

            assertTrue(candidates.stream().allMatch(candidate -> provider.resolve(candidate.getTool()).isPresent()));
            assertEquals("remove_entity_by_uid", provider.resolve(RemoveEntityByUidTool.class).orElseThrow().getName());
        }

        @Test
        @DisplayName("an unmatched suffix finds nothing")
        void unmatchedSuffix() {
            assertTrue(new ClasspathToolDiscovery(TOOLS_PACKAGE, "Handler").discover().isEmpty());
        }

        @Test
        void nameIncludesPackage() {
            assertEquals("classpath:" + TOOLS_PACKAGE, new ClasspathToolDiscovery(TOOLS_PACKAGE, "Tool").getName());
        }
    }
}
