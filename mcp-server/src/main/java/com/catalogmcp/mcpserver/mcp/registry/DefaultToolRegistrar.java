package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.mcpserver.mcp.error.ToolErrorHandler;
import com.catalogmcp.mcpserver.mcp.execution.ToolExecutionStrategy;
import com.catalogmcp.mcpserver.mcp.middleware.ToolMiddlewarePipeline;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolDispatchSurface;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Binds each tool to the dispatch surface behind the middleware pipeline, the configured
 * execution strategy and the error handler.
 *
 * <p>Per call the bound handler derives a context carrying the transport extras and the tool's
 * metadata, runs the pipeline with the strategy as final step, and turns any failure into an
 * error result. Exceptions raised while binding are logged and rethrown.
 */
@Slf4j
public class DefaultToolRegistrar implements ToolRegistrar {

    private final ToolDispatchSurface surface;
    private final ToolExecutionContext baseContext;
    private final ToolMiddlewarePipeline pipeline;
    private final ToolExecutionStrategy strategy;
    private final ToolErrorHandler errorHandler;

    public DefaultToolRegistrar(ToolDispatchSurface surface, ToolExecutionContext baseContext,
                                ToolMiddlewarePipeline pipeline, ToolExecutionStrategy strategy,
                                ToolErrorHandler errorHandler) {
        this.surface = surface;
        this.baseContext = baseContext;
        this.pipeline = pipeline;
        this.strategy = strategy;
        this.errorHandler = errorHandler;
    }

    @Override
    public void register(McpTool tool, ToolMetadata metadata) {
        String toolName = metadata.getName();
        try {
            Map<String, Object> inputSchema = metadata.hasParameterSchema()
                ? metadata.getParameterSchema().toJsonSchema()
                : ObjectSchema.empty().toJsonSchema();
            surface.tool(toolName, metadata.getDescription(), inputSchema,
                (arguments, extras) -> handle(tool, metadata, arguments, extras));
            log.info("Registered tool '{}' (strategy={}, cacheable={}, maxBatchSize={})",
                toolName, strategy.getName(), metadata.isCacheable(), metadata.getMaxBatchSize());
        } catch (RuntimeException e) {
            log.error("Failed to register tool '{}'", toolName, e);
            throw e;
        }
    }

    private CompletableFuture<ToolResult> handle(McpTool tool, ToolMetadata metadata,
                                                 Map<String, Object> arguments, Map<String, Object> extras) {
        String toolName = metadata.getName();
        Map<String, Object> args = arguments == null ? Collections.emptyMap() : arguments;
        ToolExecutionContext context = baseContext.forCall(extras, metadata);
        return errorHandler.guard(toolName, toolName, args, () ->
            pipeline.execute(args, context, (finalArgs, finalContext) ->
                strategy.execute(tool, finalArgs, finalContext, metadata)));
    }
}
