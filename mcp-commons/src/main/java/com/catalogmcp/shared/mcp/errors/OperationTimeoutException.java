package com.catalogmcp.shared.mcp.errors;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class OperationTimeoutException extends McpToolException {

    public OperationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("Operation timed out: " + operation, ErrorType.NETWORK, "TIMEOUT_ERROR", 408, true,
            describe(operation, timeout), cause);
    }

    private static Map<String, Object> describe(String operation, Duration timeout) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        if (timeout != null) {
            details.put("timeoutMs", timeout.toMillis());
        }
        return details;
    }
}
