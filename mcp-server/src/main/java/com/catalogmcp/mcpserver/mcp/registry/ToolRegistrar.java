package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.McpTool;

/**
 * Binds validated tools to the dispatch surface. Failures here are fatal to startup.
 */
public interface ToolRegistrar {

    void register(McpTool tool, ToolMetadata metadata);
}
