package com.catalogmcp.mcpserver.mcp.execution;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Picks a strategy per call from the tool's metadata.
 *
 * <p>A tool that is both batchable and cacheable goes through the cache first; only misses
 * are queued for a batch, and their results are stored on the way back.
 */
public class AdaptiveExecutionStrategy implements ToolExecutionStrategy {

    private final ToolExecutionStrategy direct;
    private final ToolExecutionStrategy cached;
    private final ToolExecutionStrategy batched;

    public AdaptiveExecutionStrategy(ToolExecutionStrategy direct, ToolExecutionStrategy cached,
                                     ToolExecutionStrategy batched) {
        this.direct = direct;
        this.cached = cached;
        this.batched = batched;
    }

    @Override
    public CompletableFuture<ToolResult> execute(McpTool tool, Map<String, Object> arguments,
                                                 ToolExecutionContext context, ToolMetadata metadata) {
        if (metadata.isBatchable() && metadata.isCacheable()) {
            McpTool batchedTool = (args, ctx) -> batched.execute(tool, args, ctx, metadata);
            return cached.execute(batchedTool, arguments, context, metadata);
        }
        return select(metadata).execute(tool, arguments, context, metadata);
    }

    /**
     * Strategy a call would use if only one were applied; cacheable batchable tools layer the
     * cache over this choice.
     */
    ToolExecutionStrategy select(ToolMetadata metadata) {
        if (metadata.isBatchable()) {
            return batched;
        }
        if (metadata.isCacheable()) {
            return cached;
        }
        return direct;
    }

    @Override
    public String getName() {
        return "auto";
    }
}
