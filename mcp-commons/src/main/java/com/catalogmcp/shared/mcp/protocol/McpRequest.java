package com.catalogmcp.shared.mcp.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.Map;

/**
 * JSON-RPC 2.0 request as sent by an MCP client.
 *
 * <pre>
 * {
 *   "jsonrpc": "2.0",
 *   "id": 7,
 *   "method": "tools/call",
 *   "params": { "name": "get_entity_by_ref", "arguments": {...}, "_meta": {...} }
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class McpRequest {

    @JsonProperty("jsonrpc")
    private String jsonrpc = "2.0";

    /**
     * Request identifier, string or number. Absent for notifications.
     */
    @JsonProperty("id")
    private Object id;

    @JsonProperty("method")
    private String method;

    @JsonProperty("params")
    private Map<String, Object> params;

    /**
     * Check if this is a valid JSON-RPC 2.0 request
     */
    @JsonIgnore
    public boolean isValid() {
        return "2.0".equals(jsonrpc) && method != null && !method.trim().isEmpty();
    }

    @JsonIgnore
    public boolean isNotification() {
        return id == null;
    }

    /**
     * Get parameter value by key with default; a value of the wrong type yields the default.
     */
    @SuppressWarnings("unchecked")
    public <T> T getParam(String key, T defaultValue) {
        if (params == null || !params.containsKey(key) || params.get(key) == null) {
            return defaultValue;
        }
        Object value = params.get(key);
        if (defaultValue != null && !defaultValue.getClass().isInstance(value)
                && !(defaultValue instanceof Map && value instanceof Map)) {
            return defaultValue;
        }
        return (T) value;
    }

    /**
     * Nested object parameter, empty when missing or not an object.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getObjectParam(String key) {
        Object value = params != null ? params.get(key) : null;
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }
}
