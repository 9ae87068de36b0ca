package com.catalogmcp.mcpserver.mcp.execution;

public enum ExecutionStrategyType {
    DIRECT,
    CACHED,
    BATCHED,
    /** Per tool: batched when batchable, cached when cacheable, direct otherwise */
    AUTO
}
