package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class GetEntitiesTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(GetEntitiesTool.class,
        ToolMetadata.builder()
            .name("get_entities")
            .description("Get entities in the catalog, optionally filtered. Supports offset pagination.")
            .parameterSchema(ObjectSchema.builder()
                .optional("filter", CatalogSchemas.FILTERS)
                .optional("fields", CatalogSchemas.FIELDS)
                .optional("limit", ScalarSchema.integer("Maximum number of entities to return"))
                .optional("offset", ScalarSchema.integer("Number of entities to skip"))
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("read")
            .cacheable(true)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        return catalog.getEntities(arguments.stringList("filter"), arguments.stringList("fields"),
                arguments.optionalInteger("limit"), arguments.optionalInteger("offset"))
            .thenApply(entities -> summary(String.format("Found %d entities", countItems(entities)), entities));
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
