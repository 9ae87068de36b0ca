package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

public class InternalServerException extends McpToolException {

    public InternalServerException(String message, Map<String, Object> details, Throwable cause) {
        super(message == null ? "Internal server error" : message,
            ErrorType.INTERNAL, "INTERNAL_SERVER_ERROR", 500, false, details, cause);
    }
}
