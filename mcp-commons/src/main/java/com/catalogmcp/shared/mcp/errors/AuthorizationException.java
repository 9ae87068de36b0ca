package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

public class AuthorizationException extends McpToolException {

    public AuthorizationException() {
        this("Insufficient permissions", null);
    }

    public AuthorizationException(String message, Map<String, Object> details) {
        super(message, ErrorType.AUTHORIZATION, "AUTHORIZATION_ERROR", 403, true, details);
    }
}
