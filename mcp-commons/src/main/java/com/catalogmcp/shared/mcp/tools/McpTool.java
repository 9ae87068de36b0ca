package com.catalogmcp.shared.mcp.tools;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Contract for every MCP tool.
 *
 * <p>A tool carries business logic only. Its name, description and parameter shape live in
 * a {@link com.catalogmcp.shared.mcp.registry.ToolMetadata} attached to the implementation
 * class through {@link com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry}. Tools do not
 * format their own error payloads: a failed future is classified at the dispatch boundary.
 */
public interface McpTool {

    /**
     * Execute the tool.
     *
     * @param arguments call arguments as decoded from the JSON-RPC request
     * @param context   catalog client, host handle and per-call transport extras; never mutated
     * @return future completing with the tool result, or exceptionally on failure
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context);
}
