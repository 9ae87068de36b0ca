package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.mcp.schema.ArraySchema;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.ParameterSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import com.catalogmcp.shared.mcp.schema.UnionSchema;

/**
 * Parameter shapes shared by several catalog tools.
 */
final class CatalogSchemas {

    static final ObjectSchema COMPOUND_ENTITY_REF = ObjectSchema.builder()
        .required("kind", ScalarSchema.string("Entity kind, e.g. Component"))
        .optional("namespace", ScalarSchema.string("Entity namespace, defaults to 'default'"))
        .required("name", ScalarSchema.string("Entity name"))
        .build();

    static final ParameterSchema ENTITY_REF = UnionSchema.anyOf(
        "Entity reference as 'kind:namespace/name' or {kind, namespace, name}",
        ScalarSchema.string("Entity reference string"),
        COMPOUND_ENTITY_REF);

    static final ParameterSchema FILTERS = ArraySchema.ofStrings(
        "Filter expressions such as 'kind=Component,spec.type=service'; alternatives are OR-ed");

    static final ParameterSchema FIELDS = ArraySchema.ofStrings(
        "Field paths to include in each entity, e.g. 'metadata.name'; all fields when omitted");

    static final ParameterSchema CONFIRM = ScalarSchema.bool(
        "Must be true to confirm this destructive operation");

    static final String CATEGORY = "catalog";
    static final String WRITE_SCOPE = "catalog:write";

    private CatalogSchemas() {
    }
}
