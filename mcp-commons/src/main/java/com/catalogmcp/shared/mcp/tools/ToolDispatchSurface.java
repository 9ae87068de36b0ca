package com.catalogmcp.shared.mcp.tools;

import java.util.Map;

/**
 * Host-side invocation surface to which tools are bound by name.
 */
public interface ToolDispatchSurface {

    /**
     * Bind a callable tool.
     *
     * @param name        unique tool name
     * @param description description advertised to clients
     * @param inputSchema JSON schema of the arguments
     * @param handler     invoked with the call arguments and transport extras
     * @throws IllegalStateException if a tool with the same name is already bound
     */
    void tool(String name, String description, Map<String, Object> inputSchema, ToolHandler handler);
}
