package com.catalogmcp.shared.mcp.errors;

import java.util.Map;

/**
 * A catalog resource does not exist. The message is always "{resource} not found".
 */
public class NotFoundException extends McpToolException {

    public NotFoundException(String resource) {
        this(resource, null);
    }

    public NotFoundException(String resource, Map<String, Object> details) {
        super(resource + " not found", ErrorType.NOT_FOUND, "NOT_FOUND_ERROR", 404, true, details);
    }
}
