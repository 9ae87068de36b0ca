package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

public class AuthenticationException extends McpToolException {

    public AuthenticationException() {
        this("Authentication required", null);
    }

    public AuthenticationException(String message, Map<String, Object> details) {
        super(message, ErrorType.AUTHENTICATION, "AUTHENTICATION_ERROR", 401, true, details);
    }
}
