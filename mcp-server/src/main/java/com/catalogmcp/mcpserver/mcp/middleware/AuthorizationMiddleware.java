package com.catalogmcp.mcpserver.mcp.middleware;

import com.catalogmcp.shared.mcp.errors.AuthorizationException;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Checks that the caller's granted scopes cover the tool's {@code requiredScopes}.
 *
 * <p>Granted scopes are read from the {@value #SCOPES_EXTRA} extra, either a collection or a
 * space separated string. Tools without required scopes always pass.
 */
@Slf4j
public class AuthorizationMiddleware implements ToolMiddleware {

    public static final int PRIORITY = 15;
    public static final String SCOPES_EXTRA = "scopes";

    private final boolean enforced;

    public AuthorizationMiddleware(boolean enforced) {
        this.enforced = enforced;
    }

    @Override
    public String getName() {
        return "authorization";
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context,
                                                 ToolInvocation next) {
        ToolMetadata metadata = context.getMetadata();
        if (!enforced || metadata == null || !metadata.hasRequiredScopes()) {
            return next.proceed(arguments, context);
        }

        Set<String> granted = grantedScopes(context.getExtra(SCOPES_EXTRA));
        List<String> missing = metadata.getRequiredScopes().stream()
            .filter(scope -> !granted.contains(scope))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.warn("Rejected call to tool '{}': missing scopes {}", metadata.getName(), missing);
            return CompletableFuture.failedFuture(new AuthorizationException(
                "Insufficient permissions for " + metadata.getName(), Map.of("missingScopes", missing)));
        }
        return next.proceed(arguments, context);
    }

    private static Set<String> grantedScopes(Object raw) {
        if (raw instanceof Collection) {
            return ((Collection<?>) raw).stream()
                .map(String::valueOf)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        }
        if (raw instanceof String) {
            return Arrays.stream(((String) raw).trim().split("\\s+"))
                .filter(scope -> !scope.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        }
        return Collections.emptySet();
    }
}
