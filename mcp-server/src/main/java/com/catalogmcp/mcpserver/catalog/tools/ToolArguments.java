package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.mcp.errors.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed read access to call arguments. Missing required values and type mismatches raise
 * {@link ValidationException}.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public Object raw(String name) {
        return values.get(name);
    }

    public Object required(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new ValidationException(String.format("'%s' is required", name), Map.of("argument", name));
        }
        return value;
    }

    public String requiredString(String name) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            throw new ValidationException(String.format("'%s' is required", name), Map.of("argument", name));
        }
        return value;
    }

    public String optionalString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw mismatch(name, "a string");
        }
        return (String) value;
    }

    public Integer optionalInteger(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw mismatch(name, "an integer");
        }
        return ((Number) value).intValue();
    }

    public boolean flag(String name) {
        Object value = values.get(name);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw mismatch(name, "a boolean");
        }
        return (Boolean) value;
    }

    /**
     * String list; absent yields an empty list
     */
    public List<String> stringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw mismatch(name, "an array of strings");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                throw mismatch(name, "an array of strings");
            }
            result.add((String) item);
        }
        return result;
    }

    public List<?> list(String name) {
        Object value = required(name);
        if (!(value instanceof List)) {
            throw mismatch(name, "an array");
        }
        return (List<?>) value;
    }

    private static ValidationException mismatch(String name, String expected) {
        return new ValidationException(String.format("'%s' must be %s", name, expected),
            Map.of("argument", name, "expected", expected));
    }
}
