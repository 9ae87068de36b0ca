package com.catalogmcp.shared.mcp.schema;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A pre-rendered JSON schema passed through verbatim. Not introspectable and accepts any value.
 */
@EqualsAndHashCode
public final class RawSchema implements ParameterSchema {

    private final Map<String, Object> jsonSchema;

    private RawSchema(Map<String, Object> jsonSchema) {
        this.jsonSchema = jsonSchema == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(jsonSchema));
    }

    public static RawSchema of(Map<String, Object> jsonSchema) {
        return new RawSchema(jsonSchema);
    }

    @Override
    public Map<String, Object> toJsonSchema() {
        return jsonSchema;
    }

    @Override
    public boolean accepts(Object value) {
        return true;
    }
}
