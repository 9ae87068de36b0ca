package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

public class ConfigurationException extends McpToolException {

    public ConfigurationException(String message, Map<String, Object> details) {
        super(message, ErrorType.INTERNAL, "CONFIGURATION_ERROR", 500, false, details);
    }
}
