package com.catalogmcp.mcpserver.mcp.middleware;

import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Ordered chain of {@link ToolMiddleware}.
 *
 * <p>Middleware is kept sorted by ascending priority. The sort is stable, so middleware with
 * equal priority runs in the order it was added.
 */
@Slf4j
public class ToolMiddlewarePipeline {

    private volatile List<ToolMiddleware> middlewares = List.of();

    public synchronized void use(ToolMiddleware middleware) {
        Objects.requireNonNull(middleware, "middleware");
        List<ToolMiddleware> updated = new ArrayList<>(middlewares);
        updated.add(middleware);
        updated.sort(Comparator.comparingInt(ToolMiddleware::getPriority));
        middlewares = List.copyOf(updated);
        log.debug("Middleware '{}' added with priority {}; order is now {}",
            middleware.getName(), middleware.getPriority(), getMiddlewareNames());
    }

    /**
     * Run the chain around {@code finalHandler}. Each call works on a snapshot of the chain,
     * so middleware added concurrently only affects later calls.
     */
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context,
                                                 ToolInvocation finalHandler) {
        List<ToolMiddleware> chain = middlewares;
        return invoke(chain, 0, finalHandler, arguments, context);
    }

    public List<String> getMiddlewareNames() {
        return middlewares.stream().map(ToolMiddleware::getName).collect(Collectors.toList());
    }

    public int size() {
        return middlewares.size();
    }

    private static CompletableFuture<ToolResult> invoke(List<ToolMiddleware> chain, int position,
                                                        ToolInvocation finalHandler,
                                                        Map<String, Object> arguments,
                                                        ToolExecutionContext context) {
        if (position >= chain.size()) {
            return finalHandler.proceed(arguments, context);
        }
        ToolMiddleware current = chain.get(position);
        ToolInvocation next = (nextArguments, nextContext) ->
            invoke(chain, position + 1, finalHandler, nextArguments, nextContext);
        return current.execute(arguments, context, next);
    }
}
