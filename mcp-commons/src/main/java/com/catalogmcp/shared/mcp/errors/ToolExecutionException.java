package com.catalogmcp.shared.mcp.errors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps a failure raised inside a tool's own logic.
 */
public class ToolExecutionException extends McpToolException {

    public ToolExecutionException(String toolName, String operation, Throwable cause) {
        super(String.format("Tool execution failed: %s.%s", toolName, operation),
            ErrorType.INTERNAL, "TOOL_EXECUTION_ERROR", 500, true, describe(toolName, operation, cause), cause);
    }

    private static Map<String, Object> describe(String toolName, String operation, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tool", toolName);
        details.put("operation", operation);
        if (cause != null) {
            details.put("originalError", cause.getMessage());
        }
        return details;
    }
}
