package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.mcpserver.catalog.EntityRefs;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ArraySchema;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@Component
public class GetEntitiesByRefsTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(GetEntitiesByRefsTool.class,
        ToolMetadata.builder()
            .name("get_entities_by_refs")
            .description("Get multiple entities by their refs. Missing entities come back as null, in request order.")
            .parameterSchema(ObjectSchema.builder()
                .required("entityRefs", ArraySchema.of(CatalogSchemas.ENTITY_REF, "Entity references"))
                .optional("fields", CatalogSchemas.FIELDS)
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("read")
            .cacheable(true)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        List<String> entityRefs = arguments.list("entityRefs").stream()
            .map(EntityRefs::toRefString)
            .collect(Collectors.toList());
        return catalog.getEntitiesByRefs(entityRefs, arguments.stringList("fields"))
            .thenApply(entities -> summary(
                String.format("Resolved %d of %d entity refs", countResolved(entities), entityRefs.size()),
                entities));
    }

    private static int countResolved(JsonNode payload) {
        JsonNode items = payload.path("items");
        int resolved = 0;
        for (JsonNode item : items) {
            if (!item.isNull()) {
                resolved++;
            }
        }
        return resolved;
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
