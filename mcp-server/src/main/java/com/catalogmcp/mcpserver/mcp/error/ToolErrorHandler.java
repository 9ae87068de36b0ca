package com.catalogmcp.mcpserver.mcp.error;

import com.catalogmcp.shared.mcp.errors.ErrorType;
import com.catalogmcp.shared.mcp.errors.McpToolException;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Dispatch boundary for execution-time failures: every error is logged, classified and turned
 * into an error {@link ToolResult}, so tools never format their own error payloads.
 */
@Slf4j
public class ToolErrorHandler {

    private final ToolErrorClassifier classifier;
    private final ToolResponseFormatter formatter;
    private final ObjectMapper objectMapper;
    private final ErrorFormat errorFormat;

    public ToolErrorHandler(ToolErrorClassifier classifier, ToolResponseFormatter formatter,
                            ObjectMapper objectMapper, ErrorFormat errorFormat) {
        this.classifier = classifier;
        this.formatter = formatter;
        this.objectMapper = objectMapper;
        this.errorFormat = errorFormat;
    }

    /**
     * Run {@code invocation} and convert any failure, thrown or completed exceptionally,
     * into an error result. The returned future never completes exceptionally.
     */
    public CompletableFuture<ToolResult> guard(String toolName, String operation, Map<String, Object> arguments,
                                               Supplier<CompletableFuture<ToolResult>> invocation) {
        CompletableFuture<ToolResult> future;
        try {
            future = invocation.get();
            if (future == null) {
                future = CompletableFuture.failedFuture(
                    new IllegalStateException("Tool returned no result future: " + toolName));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.handle((result, error) -> {
            if (error != null) {
                return handle(error, toolName, operation, arguments);
            }
            log.debug("Tool execution successful: {} ({})", toolName, operation);
            return result;
        });
    }

    public ToolResult handle(Object failure, String toolName, String operation, Map<String, Object> arguments) {
        ErrorType errorType = classifier.classify(failure);
        logFailure(failure, errorType, toolName, operation);

        if (errorFormat == ErrorFormat.SIMPLE) {
            String message = String.format("Failed to %s: %s", operation,
                failure instanceof Throwable ? ToolResponseFormatter.messageOf(failure) : "Unknown error");
            return ToolResult.errorJson(objectMapper, formatter.formatSimple(message));
        }

        Map<String, Object> details = Map.of("args", sanitizeArguments(arguments));
        StandardErrorResponse response = formatter.format(failure, errorType, toolName, operation, details);
        return ToolResult.errorJson(objectMapper, response);
    }

    private void logFailure(Object failure, ErrorType errorType, String toolName, String operation) {
        if (failure instanceof Throwable) {
            Throwable cause = ToolErrorClassifier.unwrap((Throwable) failure);
            if (cause instanceof McpToolException && ((McpToolException) cause).isOperational()) {
                log.warn("Tool execution failed: {} ({}) type={} details={}",
                    toolName, operation, errorType, ((McpToolException) cause).toLogMap());
            } else {
                log.error("Tool execution failed: {} ({}) type={}", toolName, operation, errorType, cause);
            }
        } else {
            log.error("Tool execution failed: {} ({}) type={} value={}", toolName, operation, errorType, failure);
        }
    }

    private static Map<String, Object> sanitizeArguments(Map<String, Object> arguments) {
        if (arguments == null) {
            return Collections.emptyMap();
        }
        return McpToolException.redact(arguments);
    }
}
