package com.catalogmcp.mcpserver.mcp.middleware;

import com.catalogmcp.shared.mcp.errors.AuthenticationException;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Rejects calls whose transport extras carry no {@value #AUTH_INFO_EXTRA} entry, when enabled.
 */
@Slf4j
public class AuthenticationMiddleware implements ToolMiddleware {

    public static final int PRIORITY = 10;
    public static final String AUTH_INFO_EXTRA = "authInfo";

    private final boolean required;

    public AuthenticationMiddleware(boolean required) {
        this.required = required;
    }

    @Override
    public String getName() {
        return "authentication";
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context,
                                                 ToolInvocation next) {
        if (required && context.getExtra(AUTH_INFO_EXTRA) == null) {
            log.warn("Rejected unauthenticated call to tool '{}'", context.getToolName());
            return CompletableFuture.failedFuture(new AuthenticationException(
                "Authentication required to call " + context.getToolName(), null));
        }
        return next.proceed(arguments, context);
    }
}
