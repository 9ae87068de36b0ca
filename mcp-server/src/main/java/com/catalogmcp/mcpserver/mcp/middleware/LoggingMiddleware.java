package com.catalogmcp.mcpserver.mcp.middleware;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Outermost layer: logs each call with its duration and warns when a deprecated tool is used.
 */
@Slf4j
public class LoggingMiddleware implements ToolMiddleware {

    public static final int PRIORITY = 0;

    @Override
    public String getName() {
        return "logging";
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context,
                                                 ToolInvocation next) {
        String toolName = context.getToolName();
        ToolMetadata metadata = context.getMetadata();
        if (metadata != null && metadata.isDeprecated()) {
            log.warn("Deprecated tool '{}' invoked (version {})", toolName, metadata.getVersion());
        }

        long startTime = System.currentTimeMillis();
        log.debug("Executing tool '{}' with arguments {}", toolName, arguments.keySet());
        return next.proceed(arguments, context).whenComplete((result, error) -> {
            long elapsed = System.currentTimeMillis() - startTime;
            if (error != null) {
                log.debug("Tool '{}' failed after {}ms: {}", toolName, elapsed, error.getMessage());
            } else {
                log.debug("Tool '{}' completed in {}ms (isError={})", toolName, elapsed,
                    result != null && result.isError());
            }
        });
    }
}
