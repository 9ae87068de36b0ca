package com.catalogmcp.mcpserver.mcp.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Map;

/**
 * Untyped error payload kept for callers that predate the error taxonomy:
 * {@code { "status": "error", "data": { "message": "..." } }}.
 */
@Value
public class SimpleErrorResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("data")
    Map<String, String> data;

    public static SimpleErrorResponse of(String message) {
        return new SimpleErrorResponse("error", Map.of("message", message == null ? "" : message));
    }

    @JsonIgnore
    public String getMessage() {
        return data.get("message");
    }
}
