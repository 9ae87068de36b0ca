package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ArraySchema;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class GetEntityFacetsTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(GetEntityFacetsTool.class,
        ToolMetadata.builder()
            .name("get_entity_facets")
            .description("Get value counts (facets) for the given entity fields, e.g. 'kind' or 'spec.owner'.")
            .parameterSchema(ObjectSchema.builder()
                .required("facets", ArraySchema.ofStrings("Field paths to compute facets for"))
                .optional("filter", CatalogSchemas.FILTERS)
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("read")
            .cacheable(true)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        return catalog.getEntityFacets(arguments.stringList("facets"), arguments.stringList("filter"))
            .thenApply(this::json);
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
