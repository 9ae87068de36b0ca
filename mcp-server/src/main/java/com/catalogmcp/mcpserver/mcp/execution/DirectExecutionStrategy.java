package com.catalogmcp.mcpserver.mcp.execution;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class DirectExecutionStrategy implements ToolExecutionStrategy {

    @Override
    public CompletableFuture<ToolResult> execute(McpTool tool, Map<String, Object> arguments,
                                                 ToolExecutionContext context, ToolMetadata metadata) {
        return tool.execute(arguments, context);
    }

    @Override
    public String getName() {
        return "direct";
    }
}
