package com.catalogmcp.mcpserver.mcp.execution;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * How a tool invocation is actually carried out once middleware has let it through.
 */
public interface ToolExecutionStrategy {

    CompletableFuture<ToolResult> execute(McpTool tool, Map<String, Object> arguments,
                                          ToolExecutionContext context, ToolMetadata metadata);

    /**
     * Short label used in logs and the health endpoint
     */
    String getName();
}
