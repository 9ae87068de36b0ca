package com.catalogmcp.shared.mcp.errors;

import java.util.List;
import java.util.Map;

/**
 * Tool metadata failed validation; the offending tool is skipped, startup continues.
 */
public class InvalidToolMetadataException extends McpToolException {

    private final String source;
    private final List<String> violations;

    public InvalidToolMetadataException(String source, List<String> violations) {
        super(String.format("Tool metadata validation failed for %s: %s", source, String.join("; ", violations)),
            ErrorType.VALIDATION, "INVALID_TOOL_METADATA", 400, false,
            Map.of("source", source, "violations", List.copyOf(violations)));
        this.source = source;
        this.violations = List.copyOf(violations);
    }

    public String getSource() {
        return source;
    }

    public List<String> getViolations() {
        return violations;
    }
}
