package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.mcpserver.catalog.EntityRefs;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class GetEntityAncestorsTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(GetEntityAncestorsTool.class,
        ToolMetadata.builder()
            .name("get_entity_ancestors")
            .description("Get the ancestry tree for an entity: the locations and entities that produced it.")
            .parameterSchema(ObjectSchema.builder()
                .required("entityRef", CatalogSchemas.ENTITY_REF)
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("read")
            .cacheable(true)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        return catalog.getEntityAncestors(EntityRefs.toRefString(arguments.required("entityRef")))
            .thenApply(this::json);
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
