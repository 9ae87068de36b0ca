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
public class RemoveLocationByIdTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(RemoveLocationByIdTool.class,
        ToolMetadata.builder()
            .name("remove_location_by_id")
            .description("Remove a location from the catalog by id, orphaning the entities it produced.")
            .parameterSchema(ObjectSchema.builder()
                .required("locationId", ScalarSchema.string("Location id"))
                .optional("confirm", CatalogSchemas.CONFIRM)
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("write")
            .tag("location")
            .requiresConfirmation(true)
            .requiredScope(CatalogSchemas.WRITE_SCOPE)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        String locationId = arguments.requiredString("locationId");
        return catalog.removeLocationById(locationId)
            .thenApply(ignored -> ToolResult.text("Removed location " + locationId));
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
