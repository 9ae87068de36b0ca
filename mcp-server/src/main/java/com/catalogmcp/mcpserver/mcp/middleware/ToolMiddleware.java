package com.catalogmcp.mcpserver.mcp.middleware;

import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Cross-cutting wrapper around tool execution.
 *
 * <p>A middleware may short-circuit by not calling {@code next}, pass rewritten arguments
 * or context to {@code next}, or post-process the future {@code next} returns.
 */
public interface ToolMiddleware {

    String getName();

    /**
     * Lower values run earlier, i.e. form an outer layer.
     */
    int getPriority();

    CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context,
                                          ToolInvocation next);
}
