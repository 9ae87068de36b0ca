package com.catalogmcp.mcpserver.mcp.protocol;

import com.catalogmcp.mcpserver.config.properties.McpServerProperties;
import com.catalogmcp.mcpserver.mcp.registry.ToolRegistry;
import com.catalogmcp.shared.mcp.protocol.McpError;
import com.catalogmcp.shared.mcp.protocol.McpRequest;
import com.catalogmcp.shared.mcp.protocol.McpResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Main MCP Protocol Handler for processing JSON-RPC 2.0 messages
 * Handles core MCP methods: initialize, tools/list, tools/call and ping
 */
@Service
@Slf4j
public class McpProtocolHandler {

    // MCP method constants
    public static final String METHOD_INITIALIZE = "initialize";
    public static final String METHOD_TOOLS_LIST = "tools/list";
    public static final String METHOD_TOOLS_CALL = "tools/call";
    public static final String METHOD_PING = "ping";

    public static final String PROTOCOL_VERSION = "2024-11-05";

    public static final String EXTRA_REQUEST_ID = "requestId";
    public static final String EXTRA_CONNECTION_ID = "connectionId";
    public static final String EXTRA_META = "_meta";

    private final ObjectMapper objectMapper;
    private final ToolRegistry toolRegistry;
    private final McpServerProperties properties;

    public McpProtocolHandler(ObjectMapper objectMapper, ToolRegistry toolRegistry, McpServerProperties properties) {
        this.objectMapper = objectMapper;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    /**
     * Main entry point for processing MCP messages
     *
     * @param jsonMessage     Raw JSON-RPC message
     * @param connectionId    transport connection id, passed to tools as an extra
     * @param transportExtras auth info, scopes and other transport data for the tool context
     * @return future of the response; completes with null for notifications
     */
    public CompletableFuture<McpResponse> handleMessage(String jsonMessage, String connectionId,
                                                        Map<String, Object> transportExtras) {
        log.debug("Processing MCP message from connection {}", connectionId);

        McpRequest request;
        try {
            request = objectMapper.readValue(jsonMessage, McpRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON-RPC request from connection {}: {}", connectionId, e.getOriginalMessage());
            return CompletableFuture.completedFuture(
                McpResponse.error(null, McpError.parseError(e.getOriginalMessage())));
        }

        if (!request.isValid()) {
            log.warn("Invalid JSON-RPC request from connection {}", connectionId);
            return CompletableFuture.completedFuture(
                McpResponse.error(request.getId(), McpError.invalidRequest("Invalid JSON-RPC 2.0 format")));
        }

        if (request.isNotification()) {
            log.debug("Notification '{}' from connection {}", request.getMethod(), connectionId);
            return CompletableFuture.completedFuture(null);
        }

        return routeMessage(request, connectionId, transportExtras);
    }

    /**
     * Route message to appropriate handler based on method
     */
    private CompletableFuture<McpResponse> routeMessage(McpRequest request, String connectionId,
                                                        Map<String, Object> transportExtras) {
        String method = request.getMethod();
        log.debug("Routing MCP method '{}' for connection {}", method, connectionId);

        switch (method) {
            case METHOD_INITIALIZE:
                return CompletableFuture.completedFuture(handleInitialize(request));

            case METHOD_TOOLS_LIST:
                return CompletableFuture.completedFuture(handleToolsList(request));

            case METHOD_TOOLS_CALL:
                return handleToolsCall(request, connectionId, transportExtras);

            case METHOD_PING:
                return CompletableFuture.completedFuture(McpResponse.success(request.getId(), Collections.emptyMap()));

            default:
                log.warn("Unknown MCP method '{}' from connection {}", method, connectionId);
                return CompletableFuture.completedFuture(
                    McpResponse.error(request.getId(), McpError.methodNotFound(method)));
        }
    }

    private McpResponse handleInitialize(McpRequest request) {
        McpServerProperties.ServerConfig server = properties.getServer();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", request.getParam("protocolVersion", PROTOCOL_VERSION));
        result.put("capabilities", Map.of("tools", Map.of("listChanged", false)));
        result.put("serverInfo", Map.of("name", server.getName(), "version", server.getVersion()));
        result.put("instructions", server.getDescription());
        return McpResponse.success(request.getId(), result);
    }

    /**
     * Handle tools/list request - return available tools
     */
    private McpResponse handleToolsList(McpRequest request) {
        List<Map<String, Object>> tools = toolRegistry.listTools();
        log.debug("Returning {} tools", tools.size());
        return McpResponse.success(request.getId(), Map.of("tools", tools));
    }

    /**
     * Handle tools/call request - execute a specific tool
     */
    private CompletableFuture<McpResponse> handleToolsCall(McpRequest request, String connectionId,
                                                           Map<String, Object> transportExtras) {
        String toolName = request.getParam("name", "");
        if (toolName.isEmpty()) {
            return CompletableFuture.completedFuture(
                McpResponse.error(request.getId(), McpError.invalidParams("Tool name is required")));
        }
        if (!toolRegistry.hasTool(toolName)) {
            log.warn("Tool not found: {} from connection {}", toolName, connectionId);
            return CompletableFuture.completedFuture(
                McpResponse.error(request.getId(), McpError.toolNotFound(toolName)));
        }

        Map<String, Object> arguments = request.getObjectParam("arguments");
        Map<String, Object> extras = new LinkedHashMap<>();
        if (transportExtras != null) {
            extras.putAll(transportExtras);
        }
        extras.put(EXTRA_REQUEST_ID, request.getId());
        if (connectionId != null) {
            extras.put(EXTRA_CONNECTION_ID, connectionId);
        }
        Map<String, Object> meta = request.getObjectParam(EXTRA_META);
        if (!meta.isEmpty()) {
            extras.put(EXTRA_META, meta);
        }

        log.debug("Tool call request - tool: '{}', args: {} from connection {}",
            toolName, arguments.keySet(), connectionId);

        return toolRegistry.invoke(toolName, arguments, extras)
            .thenApply(result -> McpResponse.success(request.getId(), result))
            .exceptionally(error -> {
                log.error("Failed to handle tools/call '{}' for connection {}", toolName, connectionId, error);
                return McpResponse.error(request.getId(),
                    McpError.toolExecutionError(toolName, String.valueOf(error.getMessage())));
            });
    }

    /**
     * Server identity for the health endpoint
     */
    public Map<String, Object> describe() {
        McpServerProperties.ServerConfig server = properties.getServer();
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("server", server.getName());
        description.put("version", server.getVersion());
        description.put("protocolVersion", PROTOCOL_VERSION);
        description.put("toolCount", toolRegistry.getToolCount());
        description.put("timestamp", Instant.now().toString());
        return description;
    }
}
