package com.catalogmcp.mcpserver.controller;

import com.catalogmcp.mcpserver.catalog.tools.GetEntityByRefTool;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.errors.NetworkException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full context with the catalog tools registered at startup. The catalog client is mocked.
 */
@SpringBootTest(properties = {
    "catalog.base-url=http://catalog.invalid",
    "mcp.tools.manifest-path=",
    "mcp.health.memory-degraded-percent=100",
    "mcp.health.memory-down-percent=100"
})
@AutoConfigureMockMvc
class McpControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private GetEntityByRefTool getEntityByRefTool;

    @MockBean
    private CatalogClient catalogClient;

    private MvcResult send(String json) throws Exception {
        return mockMvc.perform(post("/mcp/message")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(request().asyncStarted())
            .andReturn();
    }

    @Test
    void listsAllCatalogTools() throws Exception {
        MvcResult started = send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(1))
            .andExpect(jsonPath("$.result.tools.length()").value(13))
            .andExpect(jsonPath("$.result.tools[*].name", hasItem("get_entity_by_ref")))
            .andExpect(jsonPath("$.result.tools[*].name", hasItem("validate_entity")));
    }

    @Test
    void unconfirmedRemovalIsReturnedAsToolError() throws Exception {
        MvcResult started = send("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"remove_entity_by_uid\","
            + "\"arguments\":{\"uid\":\"1b4e28ba-2fa1-11d2-883f-0016d3cca427\"}}}");

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error").doesNotExist())
            .andExpect(jsonPath("$.result.isError").value(true));
    }

    @Test
    void notificationIsAccepted() throws Exception {
        MvcResult started = send("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isAccepted());
    }

    @Test
    void healthReportsStartupLoadAndCatalogReachability() throws Exception {
        when(catalogClient.getEntities(any(), any(), any(), any()))
            .thenReturn(CompletableFuture.completedFuture(objectMapper.readTree("[]")));

        mockMvc.perform(get("/mcp/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.tools_registered").value(13))
            .andExpect(jsonPath("$.toolCount").value(13))
            .andExpect(jsonPath("$.checks.catalog.status").value("UP"))
            .andExpect(jsonPath("$.checks.toolRegistry.details.registered").value(13))
            .andExpect(jsonPath("$.checks.memory.status").value("UP"));
    }

    @Test
    void unreachableCatalogMakesServerUnavailable() throws Exception {
        when(catalogClient.getEntities(any(), any(), any(), any()))
            .thenReturn(CompletableFuture.failedFuture(
                new NetworkException("Catalog unreachable during getEntities", Map.of(), null)));

        mockMvc.perform(get("/mcp/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("DOWN"))
            .andExpect(jsonPath("$.checks.catalog.status").value("DOWN"))
            .andExpect(jsonPath("$.checks.toolRegistry.status").value("UP"));

        mockMvc.perform(get("/mcp/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("not_ready"));
    }

    @Test
    void readyOnceToolsAndCatalogAreUp() throws Exception {
        when(catalogClient.getEntities(any(), any(), any(), any()))
            .thenReturn(CompletableFuture.completedFuture(objectMapper.readTree("[]")));

        mockMvc.perform(get("/mcp/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    void actuatorPublishesTheSameChecks() throws Exception {
        when(catalogClient.getEntities(any(), any(), any(), any()))
            .thenReturn(CompletableFuture.completedFuture(objectMapper.readTree("[]")));

        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.catalog.status").value("UP"))
            .andExpect(jsonPath("$.components.toolRegistry.status").value("UP"));
    }

    @Test
    void toolsRenderWithTheApplicationMapper() {
        assertSame(objectMapper, getEntityByRefTool.getObjectMapper());
    }

    @Test
    void manifestListsParameters() throws Exception {
        mockMvc.perform(get("/mcp/manifest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(13))
            .andExpect(jsonPath("$[?(@.name == 'get_entity_by_ref')].params[0]").value("entityRef"));
    }
}
