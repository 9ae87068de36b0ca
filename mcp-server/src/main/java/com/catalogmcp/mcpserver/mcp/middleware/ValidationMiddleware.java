package com.catalogmcp.mcpserver.mcp.middleware;

import com.catalogmcp.shared.mcp.errors.ValidationException;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Checks arguments against the tool's object schema and enforces explicit confirmation
 * for tools flagged {@code requiresConfirmation}.
 */
public class ValidationMiddleware implements ToolMiddleware {

    public static final int PRIORITY = 20;
    public static final String CONFIRM_ARGUMENT = "confirm";

    @Override
    public String getName() {
        return "validation";
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context,
                                                 ToolInvocation next) {
        ToolMetadata metadata = context.getMetadata();
        if (metadata == null) {
            return next.proceed(arguments, context);
        }

        if (metadata.getParameterSchema() instanceof ObjectSchema) {
            List<String> violations = ((ObjectSchema) metadata.getParameterSchema()).validate(arguments);
            if (!violations.isEmpty()) {
                return CompletableFuture.failedFuture(new ValidationException(
                    String.format("Invalid arguments for %s: %s", metadata.getName(), String.join("; ", violations)),
                    Map.of("violations", violations)));
            }
        }

        if (metadata.isRequiresConfirmation() && !Boolean.TRUE.equals(arguments.get(CONFIRM_ARGUMENT))) {
            return CompletableFuture.failedFuture(new ValidationException(
                String.format("%s requires confirmation: call again with \"%s\": true",
                    metadata.getName(), CONFIRM_ARGUMENT)));
        }
        return next.proceed(arguments, context);
    }
}
