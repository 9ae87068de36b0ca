package com.catalogmcp.shared.mcp.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A value matching any one of several alternatives ({@code anyOf}).
 */
@Getter
@EqualsAndHashCode
public final class UnionSchema implements ParameterSchema {

    private final List<ParameterSchema> alternatives;
    private final String description;

    private UnionSchema(List<ParameterSchema> alternatives, String description) {
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("A union needs at least one alternative");
        }
        this.alternatives = List.copyOf(alternatives);
        this.description = description;
    }

    public static UnionSchema anyOf(String description, ParameterSchema... alternatives) {
        return new UnionSchema(List.of(alternatives), description);
    }

    @Override
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("anyOf", alternatives.stream()
            .map(ParameterSchema::toJsonSchema)
            .collect(Collectors.toList()));
        if (description != null) {
            schema.put("description", description);
        }
        return schema;
    }

    @Override
    public boolean accepts(Object value) {
        return alternatives.stream().anyMatch(alternative -> alternative.accepts(value));
    }
}
