package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;

import java.util.Optional;

/**
 * Resolves the metadata attached to a tool implementation.
 */
public interface ToolMetadataProvider {

    /**
     * @param implementationOrInstance a tool class or an instance of one
     * @return the attached metadata, empty when the candidate is not a tool
     */
    Optional<ToolMetadata> resolve(Object implementationOrInstance);
}
