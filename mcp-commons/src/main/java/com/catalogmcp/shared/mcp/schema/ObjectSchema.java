package com.catalogmcp.shared.mcp.schema;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An object with named fields, kept in declaration order.
 *
 * <pre>
 * ObjectSchema.builder()
 *     .required("entityRef", ScalarSchema.string("Entity reference"))
 *     .optional("fields", ArraySchema.ofStrings("Fields to return"))
 *     .build();
 * </pre>
 */
@EqualsAndHashCode
public final class ObjectSchema implements ParameterSchema {

    private final Map<String, ParameterSchema> fields;
    private final List<String> requiredFields;
    private final String description;

    private ObjectSchema(Map<String, ParameterSchema> fields, List<String> requiredFields, String description) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.requiredFields = List.copyOf(requiredFields);
        this.description = description;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ObjectSchema empty() {
        return new Builder().build();
    }

    @Override
    public boolean isIntrospectable() {
        return true;
    }

    @Override
    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public Map<String, ParameterSchema> getFields() {
        return fields;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        fields.forEach((name, schema) -> properties.put(name, schema.toJsonSchema()));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!requiredFields.isEmpty()) {
            schema.put("required", requiredFields);
        }
        if (description != null) {
            schema.put("description", description);
        }
        return schema;
    }

    @Override
    public boolean accepts(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) value;
        return validate(map).isEmpty();
    }

    /**
     * Check call arguments against this shape. Unknown fields are tolerated; null counts as absent.
     *
     * @return human-readable violations, empty when the arguments conform
     */
    public List<String> validate(Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Collections.emptyMap() : arguments;
        List<String> violations = new ArrayList<>();
        for (String required : requiredFields) {
            if (args.get(required) == null) {
                violations.add(String.format("'%s' is required", required));
            }
        }
        fields.forEach((name, schema) -> {
            Object value = args.get(name);
            if (value != null && !schema.accepts(value)) {
                violations.add(String.format("'%s' does not match the expected %s",
                    name, schema.toJsonSchema().getOrDefault("type", "shape")));
            }
        });
        return violations;
    }

    public static final class Builder {
        private final Map<String, ParameterSchema> fields = new LinkedHashMap<>();
        private final List<String> requiredFields = new ArrayList<>();
        private String description;

        private Builder() {
        }

        public Builder required(String name, ParameterSchema schema) {
            put(name, schema);
            requiredFields.add(name);
            return this;
        }

        public Builder optional(String name, ParameterSchema schema) {
            put(name, schema);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public ObjectSchema build() {
            return new ObjectSchema(fields, requiredFields, description);
        }

        private void put(String name, ParameterSchema schema) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(schema, "schema");
            if (fields.putIfAbsent(name, schema) != null) {
                throw new IllegalArgumentException("Field declared twice: " + name);
            }
        }
    }
}
