package com.catalogmcp.mcpserver.mcp.manifest;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolManifestEntry {

    private String name;
    private String description;

    /**
     * Top-level parameter names in declaration order, empty when the schema is not an object
     */
    private List<String> params = new ArrayList<>();

    public static ToolManifestEntry from(ToolMetadata metadata) {
        return new ToolManifestEntry(metadata.getName(), metadata.getDescription(),
            new ArrayList<>(metadata.parameterNames()));
    }
}
