package com.catalogmcp.shared.mcp.errors;

import java.util.LinkedHashMap;
import java.util.Map;

public class RateLimitException extends McpToolException {

    public RateLimitException(String message, Long retryAfterSeconds, Map<String, Object> details) {
        super(message, ErrorType.RATE_LIMIT, "RATE_LIMIT_ERROR", 429, true,
            merge(retryAfter(retryAfterSeconds), details));
    }

    private static Map<String, Object> retryAfter(Long retryAfterSeconds) {
        Map<String, Object> base = new LinkedHashMap<>();
        if (retryAfterSeconds != null) {
            base.put("retryAfter", retryAfterSeconds);
        }
        return base;
    }
}
