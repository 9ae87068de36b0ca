package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ArraySchema;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class GetEntitiesByQueryTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(GetEntitiesByQueryTool.class,
        ToolMetadata.builder()
            .name("get_entities_by_query")
            .description("Query entities with filters, full-text search and ordering. Paginates with a cursor.")
            .parameterSchema(ObjectSchema.builder()
                .optional("filter", CatalogSchemas.FILTERS)
                .optional("fullTextTerm", ScalarSchema.string("Full-text search term"))
                .optional("orderFields", ArraySchema.ofStrings(
                    "Sort fields as 'field' or 'field,desc', e.g. 'metadata.name,asc'"))
                .optional("limit", ScalarSchema.integer("Maximum number of entities per page"))
                .optional("cursor", ScalarSchema.string("Cursor from a previous page's pageInfo"))
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("read")
            .tag("search")
            .cacheable(true)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        return catalog.queryEntities(arguments.stringList("filter"), arguments.optionalString("fullTextTerm"),
                arguments.stringList("orderFields"), arguments.optionalInteger("limit"),
                arguments.optionalString("cursor"))
            .thenApply(page -> {
                String summary = String.format("Found %d entities (total %s)", countItems(page),
                    page.path("totalItems").isNumber() ? page.path("totalItems").asText() : "unknown");
                return summary(summary, page);
            });
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
