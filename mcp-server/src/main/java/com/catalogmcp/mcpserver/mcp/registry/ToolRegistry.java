package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.shared.mcp.errors.NotFoundException;
import com.catalogmcp.shared.mcp.tools.ToolDispatchSurface;
import com.catalogmcp.shared.mcp.tools.ToolHandler;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Registry of tools bound for dispatch, keyed by tool name in registration order.
 * Backs {@code tools/list} and {@code tools/call}.
 */
@Service
@Slf4j
public class ToolRegistry implements ToolDispatchSurface {

    private final Map<String, BoundTool> toolsByName = new LinkedHashMap<>();

    @Override
    public synchronized void tool(String name, String description, Map<String, Object> inputSchema,
                                  ToolHandler handler) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Tool handler is required for " + name);
        }
        if (toolsByName.containsKey(name)) {
            throw new IllegalStateException("Tool already registered: " + name);
        }
        Map<String, Object> schema = inputSchema == null
            ? Map.of("type", "object", "properties", Map.of())
            : Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
        toolsByName.put(name, new BoundTool(name, description, schema, handler));
        log.debug("Tool '{}' bound, {} tool(s) registered", name, toolsByName.size());
    }

    /**
     * Get all tool descriptors in MCP {@code tools/list} form
     */
    public synchronized List<Map<String, Object>> listTools() {
        List<Map<String, Object>> tools = new ArrayList<>(toolsByName.size());
        for (BoundTool bound : toolsByName.values()) {
            Map<String, Object> descriptor = new LinkedHashMap<>();
            descriptor.put("name", bound.getName());
            descriptor.put("description", bound.getDescription());
            descriptor.put("inputSchema", bound.getInputSchema());
            tools.add(descriptor);
        }
        return tools;
    }

    /**
     * Invoke a bound tool. An unknown name yields a future failed with {@link NotFoundException}.
     */
    public CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments,
                                                Map<String, Object> extras) {
        BoundTool bound;
        synchronized (this) {
            bound = toolsByName.get(toolName);
        }
        if (bound == null) {
            return CompletableFuture.failedFuture(new NotFoundException("Tool '" + toolName + "'"));
        }
        return bound.getHandler().handle(
            arguments == null ? Collections.emptyMap() : arguments,
            extras == null ? Collections.emptyMap() : extras);
    }

    public synchronized boolean hasTool(String toolName) {
        return toolsByName.containsKey(toolName);
    }

    public synchronized Set<String> getToolNames() {
        return new LinkedHashSet<>(toolsByName.keySet());
    }

    public synchronized int getToolCount() {
        return toolsByName.size();
    }

    @Value
    static class BoundTool {
        String name;
        String description;
        Map<String, Object> inputSchema;
        ToolHandler handler;
    }
}
