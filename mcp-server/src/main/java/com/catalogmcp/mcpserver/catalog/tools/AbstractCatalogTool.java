package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.errors.ConfigurationException;
import com.catalogmcp.shared.mcp.errors.McpToolException;
import com.catalogmcp.shared.mcp.errors.ToolExecutionException;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base for tools backed by the {@link CatalogClient} found in the execution context.
 *
 * <p>Synchronous failures while preparing the call are returned as failed futures; errors of
 * unknown origin are wrapped in {@link ToolExecutionException}.
 */
public abstract class AbstractCatalogTool implements McpTool {

    private ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Application mapper, so {@code spring.jackson.*} settings shape tool output. Tools created
     * outside the container keep a default mapper.
     */
    @Autowired(required = false)
    public void setObjectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public final CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context) {
        CatalogClient catalog = context.getCatalogClient();
        if (catalog == null) {
            return CompletableFuture.failedFuture(new ConfigurationException(
                "No catalog client configured", Map.of("tool", toolName())));
        }
        try {
            return run(new ToolArguments(arguments), catalog);
        } catch (McpToolException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new ToolExecutionException(toolName(), toolName(), e));
        }
    }

    protected abstract CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog);

    protected abstract String toolName();

    protected ToolResult json(JsonNode payload) {
        return ToolResult.json(objectMapper, payload);
    }

    protected ToolResult summary(String summary, JsonNode payload) {
        return ToolResult.summaryAndJson(objectMapper, summary, payload);
    }

    /**
     * Number of entities in a list payload, either a bare array or an {@code items} array
     */
    protected static int countItems(JsonNode payload) {
        if (payload == null) {
            return 0;
        }
        if (payload.isArray()) {
            return payload.size();
        }
        JsonNode items = payload.path("items");
        return items.isArray() ? items.size() : 0;
    }
}
