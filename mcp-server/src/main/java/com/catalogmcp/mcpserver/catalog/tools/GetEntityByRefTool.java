package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.mcpserver.catalog.EntityRefs;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Single entity lookup. Frequently called in bursts by agents walking relations, so calls
 * are coalesced and cached.
 */
@Component
public class GetEntityByRefTool extends AbstractCatalogTool {

    public static final int MAX_BATCH_SIZE = 10;

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(GetEntityByRefTool.class,
        ToolMetadata.builder()
            .name("get_entity_by_ref")
            .description("Get a single entity by its reference (kind:namespace/name or compound ref).")
            .parameterSchema(ObjectSchema.builder()
                .required("entityRef", CatalogSchemas.ENTITY_REF)
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("read")
            .cacheable(true)
            .maxBatchSize(MAX_BATCH_SIZE)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        String entityRef = EntityRefs.toRefString(arguments.required("entityRef"));
        return catalog.getEntityByRef(entityRef).thenApply(this::json);
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
