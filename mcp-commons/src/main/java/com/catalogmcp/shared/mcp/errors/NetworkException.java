package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

/**
 * The upstream service could not be reached.
 */
public class NetworkException extends McpToolException {

    public NetworkException(String message, Map<String, Object> details, Throwable cause) {
        super(message, ErrorType.NETWORK, "NETWORK_ERROR", 502, true, details, cause);
    }
}
