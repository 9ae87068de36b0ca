package com.catalogmcp.shared.mcp.errors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base of all errors whose origin is known to the server.
 *
 * <p>Each subclass pins an {@link ErrorType}, so classification never has to guess from the
 * message. Operational errors are expected at runtime (bad input, missing entity, upstream
 * outage); non-operational ones indicate a configuration or programming defect.
 */
public abstract class McpToolException extends RuntimeException {

    public static final String REDACTED = "[REDACTED]";

    private static final List<String> SENSITIVE_KEYS = List.of("password", "token", "secret", "key");

    private final ErrorType errorType;
    private final String code;
    private final int statusCode;
    private final boolean operational;
    private final Map<String, Object> details;
    private final Instant timestamp;

    protected McpToolException(String message, ErrorType errorType, String code, int statusCode,
                               boolean operational, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.code = code;
        this.statusCode = statusCode;
        this.operational = operational;
        this.details = details == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.timestamp = Instant.now();
    }

    protected McpToolException(String message, ErrorType errorType, String code, int statusCode,
                               boolean operational, Map<String, Object> details) {
        this(message, errorType, code, statusCode, operational, details, null);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getCode() {
        return code;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isOperational() {
        return operational;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Full structured view for server-side logs, details unredacted.
     */
    public Map<String, Object> toLogMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", getClass().getSimpleName());
        map.put("message", getMessage());
        map.put("code", code);
        map.put("statusCode", statusCode);
        map.put("operational", operational);
        map.put("details", details);
        map.put("timestamp", timestamp.toString());
        return map;
    }

    /**
     * Client-safe view: sensitive detail values masked.
     */
    public Map<String, Object> toClientMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", getClass().getSimpleName());
        map.put("message", getMessage());
        map.put("code", code);
        map.put("statusCode", statusCode);
        map.put("timestamp", timestamp.toString());
        if (!details.isEmpty()) {
            map.put("details", redact(details));
        }
        return map;
    }

    /**
     * Copy of {@code source} with the value of every key containing a sensitive word masked.
     * Nested maps and lists are walked recursively; the source is left untouched.
     */
    public static Map<String, Object> redact(Map<String, ?> source) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null) {
                sanitized.put(key, isSensitive(key) ? REDACTED : redactValue(value));
            }
        });
        return sanitized;
    }

    private static Object redactValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, item) -> {
                String name = String.valueOf(key);
                nested.put(name, isSensitive(name) ? REDACTED : redactValue(item));
            });
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(redactValue(item));
            }
            return items;
        }
        return value;
    }

    private static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYS.stream().anyMatch(lower::contains);
    }

    protected static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        if (extra != null) {
            merged.putAll(extra);
        }
        return merged;
    }
}
