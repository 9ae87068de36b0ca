package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.shared.mcp.errors.InvalidToolMetadataException;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;

public interface ToolValidator {

    /**
     * @param sourceLabel where the metadata came from, used in log lines and the exception
     * @throws InvalidToolMetadataException listing every violation found
     */
    void validate(ToolMetadata metadata, String sourceLabel);
}
