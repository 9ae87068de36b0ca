package com.catalogmcp.shared.mcp.tools;

import com.catalogmcp.shared.mcp.errors.InternalServerException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a tool call in MCP {@code CallToolResult} form:
 *
 * <pre>
 * { "content": [ { "type": "text", "text": "..." } ], "isError": false }
 * </pre>
 */
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolResult {

    private final List<Content> content;
    private final boolean error;

    private ToolResult(List<Content> content, boolean error) {
        this.content = Collections.unmodifiableList(new ArrayList<>(content));
        this.error = error;
    }

    public static ToolResult text(String text) {
        return new ToolResult(List.of(Content.text(text)), false);
    }

    /**
     * Pretty-printed JSON rendering of {@code payload} as a single text item.
     */
    public static ToolResult json(ObjectMapper objectMapper, Object payload) {
        return new ToolResult(List.of(Content.text(toPrettyJson(objectMapper, payload))), false);
    }

    /**
     * Human summary followed by the JSON payload, for agents that read either.
     */
    public static ToolResult summaryAndJson(ObjectMapper objectMapper, String summary, Object payload) {
        return new ToolResult(List.of(Content.text(summary), Content.text(toPrettyJson(objectMapper, payload))), false);
    }

    public static ToolResult errorJson(ObjectMapper objectMapper, Object payload) {
        return new ToolResult(List.of(Content.text(toPrettyJson(objectMapper, payload))), true);
    }

    @JsonProperty("content")
    public List<Content> getContent() {
        return content;
    }

    @JsonProperty("isError")
    public boolean isError() {
        return error;
    }

    /**
     * Text of the first content item, empty when there is none.
     */
    public String firstText() {
        return content.isEmpty() || content.get(0).getText() == null ? "" : content.get(0).getText();
    }

    private static String toPrettyJson(ObjectMapper objectMapper, Object payload) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InternalServerException("Failed to serialize tool result", null, e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Content {

        @JsonProperty("type")
        private String type;

        @JsonProperty("text")
        private String text;

        public static Content text(String text) {
            return new Content("text", text);
        }
    }
}
