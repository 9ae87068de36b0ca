package com.catalogmcp.mcpserver.mcp.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Taxonomy-tagged error payload returned to clients when a tool fails.
 *
 * <pre>
 * {
 *   "status": "error",
 *   "data": { "message": "...", "code": "NOT_FOUND", "source": { "tool": "...", "operation": "..." } },
 *   "errors": [ { "status": "404", "code": "NOT_FOUND", "title": "Resource Not Found", "detail": "...",
 *                 "source": { "parameter": "..." }, "meta": { "tool": "...", "timestamp": "...", ... } } ]
 * }
 * </pre>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StandardErrorResponse {

    @JsonProperty("status")
    @Builder.Default
    String status = "error";

    @JsonProperty("data")
    ErrorData data;

    @JsonProperty("errors")
    List<ErrorObject> errors;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorData {
        String message;
        String code;
        Map<String, String> source;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorObject {
        String status;
        String code;
        String title;
        String detail;
        Map<String, String> source;
        Map<String, Object> meta;
    }
}
