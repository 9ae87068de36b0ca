package com.catalogmcp.mcpserver.catalog.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.errors.ValidationException;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.schema.ObjectSchema;
import com.catalogmcp.shared.mcp.schema.ScalarSchema;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Component
public class RemoveEntityByUidTool extends AbstractCatalogTool {

    public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance().define(RemoveEntityByUidTool.class,
        ToolMetadata.builder()
            .name("remove_entity_by_uid")
            .description("Remove an entity by its metadata.uid. The entity reappears if its location still emits it.")
            .parameterSchema(ObjectSchema.builder()
                .required("uid", ScalarSchema.string("Entity uid (a UUID)"))
                .optional("confirm", CatalogSchemas.CONFIRM)
                .build())
            .category(CatalogSchemas.CATEGORY)
            .tag("write")
            .requiresConfirmation(true)
            .requiredScope(CatalogSchemas.WRITE_SCOPE)
            .build());

    @Override
    protected CompletableFuture<ToolResult> run(ToolArguments arguments, CatalogClient catalog) {
        String uid = arguments.requiredString("uid");
        try {
            UUID.fromString(uid);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("'uid' must be a UUID", Map.of("uid", uid));
        }
        return catalog.removeEntityByUid(uid)
            .thenApply(ignored -> ToolResult.text("Removed entity " + uid));
    }

    @Override
    protected String toolName() {
        return METADATA.getName();
    }
}
