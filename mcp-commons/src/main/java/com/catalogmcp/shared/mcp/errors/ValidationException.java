package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

/**
 * Input failed validation.
 */
public class ValidationException extends McpToolException {

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(message, ErrorType.VALIDATION, "VALIDATION_ERROR", 400, true, details);
    }
}
