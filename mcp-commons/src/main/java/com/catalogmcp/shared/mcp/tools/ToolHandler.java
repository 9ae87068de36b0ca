package com.catalogmcp.shared.mcp.tools;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Callback bound to the dispatch surface for one tool.
 */
@FunctionalInterface
public interface ToolHandler {

    CompletableFuture<ToolResult> handle(Map<String, Object> arguments, Map<String, Object> extras);
}
