package com.catalogmcp.mcpserver.mcp.middleware;

import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The remainder of a middleware chain, or its final handler.
 */
@FunctionalInterface
public interface ToolInvocation {

    CompletableFuture<ToolResult> proceed(Map<String, Object> arguments, ToolExecutionContext context);
}
