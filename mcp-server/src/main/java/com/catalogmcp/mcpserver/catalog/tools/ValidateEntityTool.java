package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.errors.ValidationException;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.RawSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class ValidateEntityTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(ValidateEntityTool.class,
        ToolMetadata.builder()
            .name("validate_entity")
            .description("Validate an entity definition against the catalog's processors without storing it.")
            .parameterSchema(ObjectSchema.builder()
                .required("entity", RawSchema.of(Map.of(
                    "type", "object",
                    "description", "Entity definition with apiVersion, kind, metadata and spec")))
                .required("locationRef", ScalarSchema.string("Location the entity would be read from, as 'type:target'"))
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("validation")
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        Object entity = arguments.required("entity");
        if (!(entity instanceof Map)) {
            throw new ValidationException("'entity' must be an object", Map.of("argument", "entity"));
        }
        JsonNode entityNode = getObjectMapper().valueToTree(entity);
        return catalog.validateEntity(entityNode, arguments.requiredString("locationRef"))
            .thenApply(result -> {
                boolean valid = result.path("valid").asBoolean(result.isNull() || result.isMissingNode());
                return summary(valid ? "Entity is valid" : "Entity is invalid", result);
            });
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
