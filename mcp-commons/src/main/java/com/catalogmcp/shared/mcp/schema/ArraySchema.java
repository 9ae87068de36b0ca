package com.catalogmcp.shared.mcp.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A homogeneous JSON array.
 */
@Getter
@EqualsAndHashCode
public final class ArraySchema implements ParameterSchema {

    private final ParameterSchema items;
    private final String description;

    private ArraySchema(ParameterSchema items, String description) {
        this.items = Objects.requireNonNull(items, "items");
        this.description = description;
    }

    public static ArraySchema of(ParameterSchema items, String description) {
        return new ArraySchema(items, description);
    }

    public static ArraySchema ofStrings(String description) {
        return new ArraySchema(ScalarSchema.string(null), description);
    }

    @Override
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "array");
        schema.put("items", items.toJsonSchema());
        if (description != null) {
            schema.put("description", description);
        }
        return schema;
    }

    @Override
    public boolean accepts(Object value) {
        if (!(value instanceof Collection)) {
            return false;
        }
        for (Object item : (Collection<?>) value) {
            if (!items.accepts(item)) {
                return false;
            }
        }
        return true;
    }
}
