package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.mcpserver.catalog.EntityRefs;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class RefreshEntityTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(RefreshEntityTool.class,
        ToolMetadata.builder()
            .name("refresh_entity")
            .description("Schedule a refresh of an entity from its location.")
            .parameterSchema(ObjectSchema.builder()
                .required("entityRef", ScalarSchema.string("Entity reference as 'kind:namespace/name'"))
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("write")
            .requiredScope(CatalogSchemas.WRITE_SCOPE)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        String entityRef = EntityRefs.toRefString(arguments.requiredString("entityRef"));
        return catalog.refreshEntity(entityRef)
            .thenApply(ignored -> ToolResult.text("Refresh scheduled for " + entityRef));
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
