package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

/**
 * The catalog service answered with an error status not covered by a more specific type.
 */
public class CatalogApiException extends McpToolException {

    public CatalogApiException(String message, int statusCode, Map<String, Object> details, Throwable cause) {
        super(message, ErrorType.BACKSTAGE_API, "BACKSTAGE_API_ERROR", statusCode, true, details, cause);
    }

    public CatalogApiException(String message) {
        this(message, 502, null, null);
    }
}
