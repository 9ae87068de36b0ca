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
public class AddLocationTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(AddLocationTool.class,
        ToolMetadata.builder()
            .name("add_location")
            .description("Register a new location in the catalog. Use dryRun to preview the entities it would add.")
            .parameterSchema(ObjectSchema.builder()
                .required("type", ScalarSchema.string("Location type, usually 'url'"))
                .required("target", ScalarSchema.string("Location target, e.g. the URL of a catalog-info.yaml"))
                .optional("dryRun", ScalarSchema.bool("Validate and preview without persisting"))
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("write")
            .tag("location")
            .requiredScope(CatalogSchemas.WRITE_SCOPE)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        String type = arguments.requiredString("type");
        String target = arguments.requiredString("target");
        boolean dryRun = arguments.flag("dryRun");
        return catalog.addLocation(type, target, dryRun)
            .thenApply(location -> summary(String.format("%s location %s:%s",
                dryRun ? "Validated" : "Added", type, target), location));
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
