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
public class GetLocationByRefTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(GetLocationByRefTool.class,
        ToolMetadata.builder()
            .name("get_location_by_ref")
            .description("Get a registered location by its reference, e.g. 'url:https://host/repo/catalog-info.yaml'.")
            .parameterSchema(ObjectSchema.builder()
                .required("locationRef", ScalarSchema.string("Location reference as 'type:target'"))
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("read")
            .tag("location")
            .cacheable(true)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        return catalog.getLocationByRef(arguments.requiredString("locationRef")).thenApply(this::json);
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
