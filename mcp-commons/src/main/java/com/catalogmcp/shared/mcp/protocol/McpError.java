package com.catalogmcp.shared.mcp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 error object.
 *
 * <p>Only protocol-level failures travel as an {@code McpError}. A tool that runs and fails
 * still produces a successful JSON-RPC response whose result is flagged {@code isError}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class McpError {

    @JsonProperty("code")
    private int code;

    @JsonProperty("message")
    private String message;

    @JsonProperty("data")
    private Object data;

    // JSON-RPC 2.0 standard codes
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    // MCP-specific codes (reserved range -32000 to -32099)
    public static final int TOOL_NOT_FOUND = -32000;
    public static final int TOOL_EXECUTION_ERROR = -32001;

    public static McpError parseError(String details) {
        return new McpError(PARSE_ERROR, "Parse error", details);
    }

    public static McpError invalidRequest(String details) {
        return new McpError(INVALID_REQUEST, "Invalid Request", details);
    }

    public static McpError methodNotFound(String method) {
        return new McpError(METHOD_NOT_FOUND, "Method not found",
            String.format("Method '%s' is not supported", method));
    }

    public static McpError invalidParams(String details) {
        return new McpError(INVALID_PARAMS, "Invalid params", details);
    }

    public static McpError internalError(String details) {
        return new McpError(INTERNAL_ERROR, "Internal error", details);
    }

    public static McpError toolNotFound(String toolName) {
        return new McpError(TOOL_NOT_FOUND, "Tool not found",
            String.format("Tool '%s' is not available", toolName));
    }

    public static McpError toolExecutionError(String toolName, String details) {
        return new McpError(TOOL_EXECUTION_ERROR, "Tool execution failed",
            String.format("Tool '%s' failed: %s", toolName, details));
    }
}
