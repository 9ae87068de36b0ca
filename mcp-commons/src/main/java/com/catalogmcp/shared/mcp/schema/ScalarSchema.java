package com.catalogmcp.shared.mcp.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single JSON value: string, integer, number or boolean, optionally restricted to an enum.
 */
@Getter
@EqualsAndHashCode
public final class ScalarSchema implements ParameterSchema {

    public enum Type {
        STRING("string"),
        INTEGER("integer"),
        NUMBER("number"),
        BOOLEAN("boolean");

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String getJsonType() {
            return jsonType;
        }
    }

    private final Type type;
    private final String description;
    private final List<String> allowedValues;

    private ScalarSchema(Type type, String description, List<String> allowedValues) {
        this.type = type;
        this.description = description;
        this.allowedValues = allowedValues == null ? Collections.emptyList() : List.copyOf(allowedValues);
    }

    public static ScalarSchema string(String description) {
        return new ScalarSchema(Type.STRING, description, null);
    }

    public static ScalarSchema oneOf(String description, List<String> allowedValues) {
        return new ScalarSchema(Type.STRING, description, allowedValues);
    }

    public static ScalarSchema integer(String description) {
        return new ScalarSchema(Type.INTEGER, description, null);
    }

    public static ScalarSchema number(String description) {
        return new ScalarSchema(Type.NUMBER, description, null);
    }

    public static ScalarSchema bool(String description) {
        return new ScalarSchema(Type.BOOLEAN, description, null);
    }

    @Override
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type.getJsonType());
        if (description != null) {
            schema.put("description", description);
        }
        if (!allowedValues.isEmpty()) {
            schema.put("enum", allowedValues);
        }
        return schema;
    }

    @Override
    public boolean accepts(Object value) {
        switch (type) {
            case STRING:
                return value instanceof String
                    && (allowedValues.isEmpty() || allowedValues.contains(value));
            case INTEGER:
                return value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof BigInteger;
            case NUMBER:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            default:
                return false;
        }
    }
}
