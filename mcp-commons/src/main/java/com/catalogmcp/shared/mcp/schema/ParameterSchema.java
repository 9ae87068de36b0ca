package com.catalogmcp.shared.mcp.schema;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Structural description of a tool's parameters.
 *
 * <p>Only object-shaped schemas are introspectable: they can list their top-level
 * field names in declaration order. Every schema can render itself as a JSON schema
 * map, which is the form advertised to MCP clients.
 */
public interface ParameterSchema {

    /**
     * JSON schema rendering of this shape
     */
    Map<String, Object> toJsonSchema();

    /**
     * Whether {@code value} structurally matches this shape. Used for argument checks.
     */
    boolean accepts(Object value);

    default boolean isIntrospectable() {
        return false;
    }

    /**
     * Top-level field names in declaration order; empty for non-introspectable shapes.
     */
    default List<String> fieldNames() {
        return Collections.emptyList();
    }
}
