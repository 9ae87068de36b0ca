package com.catalogmcp.shared.mcp.errors;

/**
 * Flat error taxonomy reported to MCP clients.
 */
public enum ErrorType {

    VALIDATION("VALIDATION_ERROR", "400", "Validation Error"),
    AUTHENTICATION("AUTHENTICATION_ERROR", "401", "Authentication Failed"),
    AUTHORIZATION("AUTHORIZATION_ERROR", "403", "Access Denied"),
    NOT_FOUND("NOT_FOUND", "404", "Resource Not Found"),
    CONFLICT("CONFLICT", "409", "Resource Conflict"),
    RATE_LIMIT("RATE_LIMIT", "429", "Rate Limit Exceeded"),
    NETWORK("NETWORK_ERROR", "502", "Network Error"),
    BACKSTAGE_API("BACKSTAGE_API_ERROR", "502", "Backstage API Error"),
    INTERNAL("INTERNAL_ERROR", "500", "Internal Server Error"),
    UNKNOWN("UNKNOWN_ERROR", "500", "Unknown Error");

    private final String code;
    private final String httpStatus;
    private final String title;

    ErrorType(String code, String httpStatus, String title) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.title = title;
    }

    /**
     * Stable machine-readable code
     */
    public String getCode() {
        return code;
    }

    /**
     * HTTP-like status as a string, e.g. "404"
     */
    public String getHttpStatus() {
        return httpStatus;
    }

    public String getTitle() {
        return title;
    }
}
