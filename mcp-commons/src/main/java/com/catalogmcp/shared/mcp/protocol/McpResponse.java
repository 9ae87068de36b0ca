package com.catalogmcp.shared.mcp.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 response. Exactly one of {@code result} and {@code error} is set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class McpResponse {

    @JsonProperty("jsonrpc")
    private String jsonrpc = "2.0";

    @JsonProperty("id")
    private Object id;

    @JsonProperty("result")
    private Object result;

    @JsonProperty("error")
    private McpError error;

    public static McpResponse success(Object id, Object result) {
        McpResponse response = new McpResponse();
        response.setId(id);
        response.setResult(result);
        return response;
    }

    public static McpResponse error(Object id, McpError error) {
        McpResponse response = new McpResponse();
        response.setId(id);
        response.setError(error);
        return response;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null && result != null;
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }
}
