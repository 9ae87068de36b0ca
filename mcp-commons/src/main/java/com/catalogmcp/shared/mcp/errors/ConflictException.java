package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

public class ConflictException extends McpToolException {

    public ConflictException(String message, Map<String, Object> details) {
        super(message, ErrorType.CONFLICT, "CONFLICT_ERROR", 409, true, details);
    }
}
